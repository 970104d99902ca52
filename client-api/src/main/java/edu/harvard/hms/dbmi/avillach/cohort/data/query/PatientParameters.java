package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demographic attributes, each matched case-insensitively as a LIKE pattern.
 */
public record PatientParameters(String gender, String religion, String race) implements CriterionParameters {

    public PatientParameters {
        gender = CriterionParameters.blankToNull(gender);
        religion = CriterionParameters.blankToNull(religion);
        race = CriterionParameters.blankToNull(race);
    }

    @Override
    public FilterExpression toFilter(CriterionDomain domain) {
        List<FilterExpression> filters = new ArrayList<>();
        if (gender != null) {
            filters.add(FilterExpression.likeIgnoreCase(Relation.D_PERSON.column("GENDER"), gender));
        }
        if (religion != null) {
            filters.add(FilterExpression.likeIgnoreCase(Relation.D_PERSON.column("RELIGION"), religion));
        }
        if (race != null) {
            filters.add(FilterExpression.likeIgnoreCase(Relation.D_PERSON.column("RACE"), race));
        }
        return FilterExpression.and(filters);
    }

    @Override
    public Map<String, Object> toAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("gender", gender);
        attributes.put("religion", religion);
        attributes.put("race", race);
        return attributes;
    }

    static PatientParameters fromAttributes(Map<String, ?> attributes) {
        return new PatientParameters(
            Attributes.text(attributes, "gender"), Attributes.text(attributes, "religion"), Attributes.text(attributes, "race")
        );
    }
}
