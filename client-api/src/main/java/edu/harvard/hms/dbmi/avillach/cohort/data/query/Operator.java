package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import java.util.Locale;

public enum Operator {
    AND, OR;

    /**
     * Key of a composite in the dictionary form of a predicate.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
