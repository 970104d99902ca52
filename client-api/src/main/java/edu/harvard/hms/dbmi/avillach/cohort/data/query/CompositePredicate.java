package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Two predicates combined with AND or OR, resolved by combining the identifier sets of both sides.
 */
public final class CompositePredicate implements Predicate {

    private final Operator operator;

    private final Predicate left;

    private final Predicate right;

    private final String label;

    private volatile String structuralKey;

    public CompositePredicate(Operator operator, Predicate left, Predicate right) {
        this(operator, left, right, null);
    }

    private CompositePredicate(Operator operator, Predicate left, Predicate right, String label) {
        if (operator == null || left == null || right == null) {
            throw new IllegalArgumentException("A composite needs an operator and two children");
        }
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.label = label;
    }

    public Operator getOperator() {
        return operator;
    }

    public Predicate getLeft() {
        return left;
    }

    public Predicate getRight() {
        return right;
    }

    public List<Predicate> getChildren() {
        return List.of(left, right);
    }

    /**
     * Leaves of this tree, left to right. Merged criteria count as one leaf.
     */
    public List<Predicate> leaves() {
        List<Predicate> leaves = new ArrayList<>();
        for (Predicate child : getChildren()) {
            if (child instanceof CompositePredicate composite) {
                leaves.addAll(composite.leaves());
            } else {
                leaves.add(child);
            }
        }
        return leaves;
    }

    @Override
    public Map<String, Object> toDict() {
        return Map.of(operator.key(), List.of(left.toDict(), right.toDict()));
    }

    @Override
    public String structuralKey() {
        String key = structuralKey;
        if (key == null) {
            key = PredicateCodec.canonicalJson(toDict());
            structuralKey = key;
        }
        return key;
    }

    @Override
    public CompositePredicate withLabel(String label) {
        return new CompositePredicate(operator, left, right, label);
    }

    @Override
    public String label() {
        if (label != null) {
            return label;
        }
        return "(" + left.label() + " " + operator + " " + right.label() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompositePredicate)) return false;
        return structuralKey().equals(((CompositePredicate) o).structuralKey());
    }

    @Override
    public int hashCode() {
        return structuralKey().hashCode();
    }

    @Override
    public String toString() {
        return structuralKey();
    }
}
