package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes shared by criteria over the fact relation. Code and context are matched case-sensitively and must be given together,
 * category and description are matched case-insensitively. All four are LIKE patterns.
 */
public record FactParameters(String code, String context, String category, String description) implements CriterionParameters {

    public FactParameters {
        code = CriterionParameters.blankToNull(code);
        context = CriterionParameters.blankToNull(context);
        category = CriterionParameters.blankToNull(category);
        description = CriterionParameters.blankToNull(description);
        if ((code == null) != (context == null)) {
            throw new IllegalArgumentException("Code or context missing, both are required together. Example: ('035.%', 'ICD-9')");
        }
    }

    public static FactParameters ofCode(String code, String context) {
        return new FactParameters(code, context, null, null);
    }

    public static FactParameters ofCategory(String category) {
        return new FactParameters(null, null, category, null);
    }

    public static FactParameters ofDescription(String description) {
        return new FactParameters(null, null, null, description);
    }

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        List<FilterExpression> filters = new ArrayList<>();
        if (context != null) {
            filters.add(FilterExpression.like(domain.contextColumn(), context));
        }
        if (category != null) {
            filters.add(FilterExpression.likeIgnoreCase(domain.categoryColumn(), category));
        }
        if (code != null) {
            filters.add(FilterExpression.like(domain.codeColumn(), code));
        }
        if (description != null) {
            filters.add(FilterExpression.likeIgnoreCase(domain.descriptionColumn(), description));
        }
        return FilterExpression.and(filters);
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("code", code);
        attributes.put("context", context);
        attributes.put("category", category);
        attributes.put("description", description);
        return attributes;
    }

    static FactParameters fromAttributes(Map<String, ?> attributes) {
        return new FactParameters(
            Attributes.text(attributes, "code"), Attributes.text(attributes, "context"), Attributes.text(attributes, "category"),
            Attributes.text(attributes, "description")
        );
    }
}
