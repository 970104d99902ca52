package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A laboratory test by name. {@code abnormal} restricts results to flagged ({@code true}) or unflagged ({@code false}) ones.
 */
public record LabValueParameters(String name, Boolean abnormal) implements CriterionParameters {

    public static final String ABNORMAL_FLAG = "Y";

    public LabValueParameters {
        name = CriterionParameters.blankToNull(name);
    }

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        List<FilterExpression> filters = new ArrayList<>();
        if (name != null) {
            filters.add(FilterExpression.likeIgnoreCase(domain.descriptionColumn(), name));
        }
        if (abnormal != null) {
            filters.add(FilterExpression.compare(
                Relation.EPIC_LAB.column("ABNORMAL_FLAG"), abnormal ? ComparisonOperator.EQ : ComparisonOperator.NE, ABNORMAL_FLAG
            ));
        }
        return FilterExpression.and(filters);
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("abnormal", abnormal);
        return attributes;
    }

    static LabValueParameters fromAttributes(Map<String, ?> attributes) {
        return new LabValueParameters(Attributes.text(attributes, "name"), Attributes.flag(attributes, "abnormal"));
    }
}
