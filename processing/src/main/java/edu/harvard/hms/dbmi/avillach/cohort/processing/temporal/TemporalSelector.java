package edu.harvard.hms.dbmi.avillach.cohort.processing.temporal;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.cohort.exception.AmbiguousTemporalSelectorException;

/**
 * The anchor events of a temporal join and how targets must relate to them.
 */
public record TemporalSelector(Predicate anchor, TemporalRelation relation) {

    public TemporalSelector {
        if (anchor == null || relation == null) {
            throw new AmbiguousTemporalSelectorException();
        }
    }

    /**
     * Exactly one of the three anchors must be given.
     *
     * @throws AmbiguousTemporalSelectorException otherwise, before anything is queried
     */
    public static TemporalSelector of(Predicate relativeTo, Predicate before, Predicate after) {
        int given = (relativeTo == null ? 0 : 1) + (before == null ? 0 : 1) + (after == null ? 0 : 1);
        if (given != 1) {
            throw new AmbiguousTemporalSelectorException();
        }
        if (relativeTo != null) {
            return relativeTo(relativeTo);
        }
        return before != null ? before(before) : after(after);
    }

    public static TemporalSelector relativeTo(Predicate anchor) {
        return new TemporalSelector(anchor, TemporalRelation.RELATIVE);
    }

    public static TemporalSelector before(Predicate anchor) {
        return new TemporalSelector(anchor, TemporalRelation.BEFORE);
    }

    public static TemporalSelector after(Predicate anchor) {
        return new TemporalSelector(anchor, TemporalRelation.AFTER);
    }
}
