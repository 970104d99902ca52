package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Dimension;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.*;

/**
 * Disjunction of two predicates over the same base relation, answered by one query. Built by {@link ClauseMerger}.
 */
public final class MergedCriterion implements DatabasePredicate {

    private final DatabasePredicate left;

    private final DatabasePredicate right;

    private final Set<Dimension> joinedDimensions;

    private final Set<Dimension> requiredDimensions;

    private final List<ColumnRef> projectionColumns;

    private final String label;

    private volatile String structuralKey;

    MergedCriterion(DatabasePredicate left, DatabasePredicate right) {
        this(left, right, null);
    }

    private MergedCriterion(DatabasePredicate left, DatabasePredicate right, String label) {
        this.left = left;
        this.label = label;
        this.right = right;

        EnumSet<Dimension> joined = EnumSet.noneOf(Dimension.class);
        joined.addAll(left.joinedDimensions());
        joined.addAll(right.joinedDimensions());
        this.joinedDimensions = Sets.immutableEnumSet(joined);

        EnumSet<Dimension> required = EnumSet.noneOf(Dimension.class);
        required.addAll(Sets.intersection(left.requiredDimensions(), right.requiredDimensions()));
        this.requiredDimensions = Sets.immutableEnumSet(required);

        LinkedHashSet<ColumnRef> projection = new LinkedHashSet<>(left.projectionColumns());
        projection.addAll(right.projectionColumns());
        this.projectionColumns = ImmutableList.copyOf(projection);
    }

    public DatabasePredicate getLeft() {
        return left;
    }

    public DatabasePredicate getRight() {
        return right;
    }

    @Override
    public Relation baseRelation() {
        return left.baseRelation();
    }

    @Override
    public Set<Dimension> joinedDimensions() {
        return joinedDimensions;
    }

    @Override
    public Set<Dimension> requiredDimensions() {
        return requiredDimensions;
    }

    @Override
    public FilterExpression filter() {
        return FilterExpression.or(left.filter(), right.filter());
    }

    @Override
    public List<ColumnRef> projectionColumns() {
        return projectionColumns;
    }

    @Override
    public Map<String, Object> toDict() {
        return Map.of(Operator.OR.key(), List.of(left.toDict(), right.toDict()));
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
    public MergedCriterion withLabel(String label) {
        return new MergedCriterion(left, right, label);
    }

    @Override
    public String label() {
        if (label != null) {
            return label;
        }
        return "(" + left.label() + " OR " + right.label() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergedCriterion)) return false;
        return structuralKey().equals(((MergedCriterion) o).structuralKey());
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
