package edu.harvard.hms.dbmi.avillach.cohort.processing;

import java.util.Map;

/**
 * Summary of a cohort: mean and sample standard deviation of the subjects' mean age in years, and the share of each gender.
 */
public record Demographics(double meanAgeYears, double stdAgeYears, Map<String, Double> genderDistribution) {

    public Demographics {
        genderDistribution = Map.copyOf(genderDistribution);
    }
}
