package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.CriterionKind;

import java.util.Map;

import static edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation.AggregationFunction.*;

/**
 * Ready-made pivot settings per criterion kind. Events are widened by their description.
 */
public final class PivotConfigurations {

    public static final String DESCRIPTION = "description";
    public static final String NUMERIC_VALUE = "numeric_value";

    /** Numeric ranges for measurements, occurrence counts for procedures and drugs, presence of diagnoses. */
    public static final Map<CriterionKind, PivotConfiguration> DEFAULT = Map.of(
        CriterionKind.LAB_VALUE, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, MIN, MEDIAN, MAX),
        CriterionKind.VITAL_SIGN, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, MIN, MEDIAN, MAX),
        CriterionKind.PROCEDURE, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, COUNT),
        CriterionKind.DRUG, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, COUNT),
        CriterionKind.DIAGNOSIS, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, ANY).withFillThreshold(0.1)
    );

    /** Presence only. */
    public static final Map<CriterionKind, PivotConfiguration> BINARY = Map.of(
        CriterionKind.LAB_VALUE, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, ANY),
        CriterionKind.VITAL_SIGN, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, ANY),
        CriterionKind.PROCEDURE, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, ANY),
        CriterionKind.DRUG, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, ANY),
        CriterionKind.DIAGNOSIS, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, ANY)
    );

    public static final Map<CriterionKind, PivotConfiguration> COUNTED = Map.of(
        CriterionKind.LAB_VALUE, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, COUNT),
        CriterionKind.VITAL_SIGN, PivotConfiguration.of(DESCRIPTION, NUMERIC_VALUE, COUNT),
        CriterionKind.PROCEDURE, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, COUNT),
        CriterionKind.DRUG, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, COUNT),
        CriterionKind.DIAGNOSIS, PivotConfiguration.of(DESCRIPTION, DESCRIPTION, COUNT)
    );

    private PivotConfigurations() {
    }
}
