package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A drug, matched by name against the material, generic and brand names. Drugs are materials of category {@code Drug}.
 */
public record DrugParameters(String name, String code, String context) implements CriterionParameters {

    public static final String CATEGORY = "Drug";

    private static final List<String> NAME_COLUMNS = List.of("MATERIAL_NAME", "GENERIC_NAME", "BRAND1", "BRAND2");

    public DrugParameters {
        name = CriterionParameters.blankToNull(name);
        code = CriterionParameters.blankToNull(code);
        context = CriterionParameters.blankToNull(context);
    }

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        FilterExpression material = new FactParameters(code, context, CATEGORY, null).toFilter(domain);
        if (name == null) {
            return material;
        }
        FilterExpression names = FilterExpression.or(
            NAME_COLUMNS.stream().map(column -> FilterExpression.likeIgnoreCase(Relation.FD_MATERIAL.column(column), name)).toList()
        );
        return FilterExpression.and(material, names);
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name);
        attributes.put("code", code);
        attributes.put("context", context);
        return attributes;
    }

    static DrugParameters fromAttributes(Map<String, ?> attributes) {
        return new DrugParameters(
            Attributes.text(attributes, "name"), Attributes.text(attributes, "code"), Attributes.text(attributes, "context")
        );
    }
}
