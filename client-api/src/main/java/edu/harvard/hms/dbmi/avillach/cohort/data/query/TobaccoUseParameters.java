package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import edu.harvard.hms.dbmi.avillach.cohort.exception.MalformedSerializationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tobacco use observations, optionally restricted to one kind of use.
 */
public record TobaccoUseParameters(TobaccoUseType use) implements CriterionParameters {

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        FilterExpression tobacco = new MetaDataParameters(MetaDataParameters.TOBACCO_USE).toFilter(domain);
        if (use == null) {
            return tobacco;
        }
        return FilterExpression.and(tobacco, new FilterExpression.In(Relation.FACT.column("VALUE"), new ArrayList<>(use.getRecordedValues())));
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("use", use == null ? null : use.name());
        return attributes;
    }

    static TobaccoUseParameters fromAttributes(Map<String, ?> attributes) {
        String use = Attributes.text(attributes, "use");
        if (use == null) {
            return new TobaccoUseParameters(null);
        }
        try {
            return new TobaccoUseParameters(TobaccoUseType.valueOf(use));
        } catch (IllegalArgumentException e) {
            throw new MalformedSerializationException("Unknown tobacco use " + use, e);
        }
    }
}
