package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Dimension;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.List;
import java.util.Set;

/**
 * A predicate answered by a single query against one base relation.
 */
public sealed interface DatabasePredicate extends Predicate permits Criterion, MergedCriterion {

    Relation baseRelation();

    /**
     * Every dimension the query joins in.
     */
    Set<Dimension> joinedDimensions();

    /**
     * Dimensions every matching row must join to. The rest of {@link #joinedDimensions()} is joined optionally.
     */
    Set<Dimension> requiredDimensions();

    FilterExpression filter();

    List<ColumnRef> projectionColumns();

    default ColumnRef identifierColumn() {
        return baseRelation().identifierColumn();
    }
}
