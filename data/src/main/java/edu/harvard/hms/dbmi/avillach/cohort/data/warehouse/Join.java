package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

/**
 * Joins {@code relation} into a query where {@code existing} (already part of the query) equals {@code joined}.
 */
public record Join(Relation relation, ColumnRef existing, ColumnRef joined, JoinType type) {

    public Join {
        if (joined.relation() != relation) {
            throw new IllegalArgumentException("Join key " + joined + " does not belong to " + relation);
        }
    }
}
