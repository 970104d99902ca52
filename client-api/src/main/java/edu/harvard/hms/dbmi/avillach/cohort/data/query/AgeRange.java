package edu.harvard.hms.dbmi.avillach.cohort.data.query;

/**
 * Age constraint in days, minimum inclusive and maximum exclusive. Either bound may be open.
 */
public record AgeRange(Integer minDays, Integer maxDays) {

    public AgeRange {
        if (minDays != null && maxDays != null && minDays > maxDays) {
            throw new IllegalArgumentException("Minimum age " + minDays + " is above maximum age " + maxDays);
        }
    }

    public static AgeRange ofYears(Integer minYears, Integer maxYears) {
        return new AgeRange(minYears == null ? null : minYears * 365, maxYears == null ? null : maxYears * 365);
    }
}
