package edu.harvard.hms.dbmi.avillach.cohort.data.query;

public final class Predicates {

    private Predicates() {
    }

    /**
     * Combines two predicates. A disjunction of two predicates over the same base relation becomes a single merged criterion,
     * everything else a {@link CompositePredicate}.
     */
    public static Predicate combine(Predicate left, Predicate right, Operator operator) {
        if (left == null || right == null || operator == null) {
            throw new IllegalArgumentException("Cannot combine " + left + " and " + right + " with " + operator);
        }
        if (operator == Operator.OR && ClauseMerger.canMerge(left, right)) {
            return ClauseMerger.merge((DatabasePredicate) left, (DatabasePredicate) right);
        }
        return new CompositePredicate(operator, left, right);
    }
}
