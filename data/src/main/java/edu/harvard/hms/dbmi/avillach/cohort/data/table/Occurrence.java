package edu.harvard.hms.dbmi.avillach.cohort.data.table;

/**
 * A subject for whom a condition held at the given age.
 */
public record Occurrence(String subjectId, Integer ageInDays) {

    public Occurrence {
        if (subjectId == null) {
            throw new IllegalArgumentException("An occurrence needs a subject id");
        }
    }

    public static Occurrence of(String subjectId) {
        return new Occurrence(subjectId, null);
    }
}
