package edu.harvard.hms.dbmi.avillach.cohort.processing.temporal;

/**
 * How target events must relate in time to the anchor events they are joined to.
 */
public enum TemporalRelation {
    /** Any delta, including targets that never occurred. */
    RELATIVE,
    /** Targets at or before the anchor. */
    BEFORE,
    /** Targets at or after the anchor. */
    AFTER;

    public boolean accepts(Integer timeDelta) {
        switch (this) {
            case BEFORE:
                return timeDelta != null && timeDelta <= 0;
            case AFTER:
                return timeDelta != null && timeDelta >= 0;
            default:
                return true;
        }
    }
}
