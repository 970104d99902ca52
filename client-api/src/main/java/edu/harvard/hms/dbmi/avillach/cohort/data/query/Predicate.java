package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import java.util.Map;
import java.util.Set;

/**
 * A condition that holds for a set of subjects. Predicates are immutable; builder methods return new instances.
 */
public sealed interface Predicate permits DatabasePredicate, CompositePredicate, IdentifierListPredicate {

    /**
     * Canonical serialization of everything that defines this predicate. Two predicates with equal keys select the same rows from
     * the same warehouse state.
     */
    String structuralKey();

    /**
     * Identifiers known without asking the warehouse. Empty unless the predicate was built from known identifiers.
     */
    default Set<String> identifierCache() {
        return Set.of();
    }

    /**
     * Dictionary form, {@code {"class": ..., "attributes": {...}}} for leaves and {@code {"and"|"or": [left, right]}} for
     * composites.
     */
    Map<String, Object> toDict();

    /**
     * Human readable name, used for log lines and as the column name of derived flags.
     */
    String label();

    /**
     * The same predicate under another label. The label is not part of the structural key or the dictionary form, so relabelled
     * predicates share cached results with the original.
     */
    Predicate withLabel(String label);

    default Predicate and(Predicate other) {
        return Predicates.combine(this, other, Operator.AND);
    }

    default Predicate or(Predicate other) {
        return Predicates.combine(this, other, Operator.OR);
    }
}
