package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.exception.IncompatibleCombinationException;

import java.util.List;

/**
 * Merges disjunctions of predicates over the same base relation into a single query.
 */
public final class ClauseMerger {

    private ClauseMerger() {
    }

    public static boolean canMerge(Predicate left, Predicate right) {
        return left instanceof DatabasePredicate l && right instanceof DatabasePredicate r && l.baseRelation() == r.baseRelation();
    }

    public static MergedCriterion merge(DatabasePredicate left, DatabasePredicate right) {
        if (left.baseRelation() != right.baseRelation()) {
            throw new IncompatibleCombinationException(
                "Cannot merge predicates over " + left.baseRelation() + " and " + right.baseRelation() + " into one query"
            );
        }
        return new MergedCriterion(left, right);
    }

    public static DatabasePredicate mergeAll(List<? extends DatabasePredicate> predicates) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        DatabasePredicate merged = predicates.get(0);
        for (DatabasePredicate next : predicates.subList(1, predicates.size())) {
            merged = merge(merged, next);
        }
        return merged;
    }
}
