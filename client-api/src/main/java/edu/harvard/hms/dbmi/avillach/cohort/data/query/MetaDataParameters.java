package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Observations recorded as metadata rather than diagnoses. The name matches any of the four metadata levels.
 */
public record MetaDataParameters(String name) implements CriterionParameters {

    public static final String ALCOHOL_USE = "Alcohol Use";

    public static final String DRUG_USE = "Drug Use";

    public static final String TOBACCO_USE = "Tobacco Use";

    private static final List<String> LEVELS = List.of("LEVEL1", "LEVEL2", "LEVEL3", "LEVEL4");

    public MetaDataParameters {
        name = CriterionParameters.blankToNull(name);
    }

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        if (name == null) {
            return FilterExpression.always();
        }
        return FilterExpression.or(
            LEVELS.stream().map(level -> FilterExpression.likeIgnoreCase(Relation.D_METADATA.column(level), name)).toList()
        );
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        return attributes;
    }

    static MetaDataParameters fromAttributes(Map<String, ?> attributes) {
        return new MetaDataParameters(Attributes.text(attributes, "name"));
    }
}
