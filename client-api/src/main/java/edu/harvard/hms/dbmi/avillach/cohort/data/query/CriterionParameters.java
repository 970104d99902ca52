package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;

import java.util.Map;

/**
 * Typed attributes of one kind of criterion.
 */
public sealed interface CriterionParameters
    permits PatientParameters, FactParameters, DrugParameters, MetaDataParameters, TobaccoUseParameters, LabValueParameters {

    FilterExpression toFilter(CriterionDomain domain);

    /**
     * The {@code attributes} entry of the dictionary form. Unset attributes are present with a null value.
     */
    Map<String, Object> toAttributes();

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
