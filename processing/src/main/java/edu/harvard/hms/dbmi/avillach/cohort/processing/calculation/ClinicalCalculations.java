package edu.harvard.hms.dbmi.avillach.cohort.processing.calculation;

import java.util.Set;

/**
 * Derived clinical measures computed from extracted values.
 */
public final class ClinicalCalculations {

    public static final String FEMALE = "Female";

    public static final Set<String> BLACK_RACES = Set.of("Black Or African-American", "African American (Black)");

    private ClinicalCalculations() {
    }

    /**
     * Estimated glomerular filtration rate in mL/min/1.73m² by the CKD-EPI creatinine equation (2009). Valid for adults only.
     *
     * @param creatinine serum creatinine in mg/dL
     * @param age age in years
     * @param gender as recorded on the person, {@code Female} is matched exactly
     * @param race as recorded on the person
     */
    public static double estimatedGfr(double creatinine, double age, String gender, String race) {
        if (creatinine <= 0) {
            throw new IllegalArgumentException("Creatinine must be positive, was " + creatinine);
        }
        boolean female = FEMALE.equals(gender);
        boolean black = race != null && BLACK_RACES.contains(race);
        double alpha = female ? -0.329 : -0.411;
        double k = female ? 0.7 : 0.9;
        double ratio = creatinine / k;
        return 141
            * Math.pow(Math.min(ratio, 1), alpha)
            * Math.pow(Math.max(ratio, 1), -1.209)
            * Math.pow(0.993, age)
            * (female ? 1.018 : 1)
            * (black ? 1.159 : 1);
    }
}
