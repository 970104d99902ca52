package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.DatabasePredicate;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.*;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the warehouse queries for database predicates.
 */
@Component
public class QueryPlanner {

    /**
     * Query returning the distinct identifiers of the subjects matched by {@code predicate}.
     */
    public QueryDescription identifierQuery(DatabasePredicate predicate) {
        ColumnRef identifier = predicate.identifierColumn();
        return new QueryDescription(predicate.baseRelation(), joins(predicate), predicate.filter(), List.of(identifier), identifier, true);
    }

    /**
     * Query returning the distinct rows of the projection columns for the events matched by {@code predicate}.
     */
    public QueryDescription dataQuery(DatabasePredicate predicate) {
        return new QueryDescription(
            predicate.baseRelation(), joins(predicate), predicate.filter(), predicate.projectionColumns(), predicate.identifierColumn(), true
        );
    }

    /**
     * The person relation first, then required dimensions as inner joins, then the dimensions only some merged branches need as
     * left joins, each group in declaration order.
     */
    List<Join> joins(DatabasePredicate predicate) {
        Relation base = predicate.baseRelation();
        List<Join> joins = new ArrayList<>();
        if (base.requiresPersonJoin()) {
            joins.add(new Join(Relation.D_PERSON, base.column("PERSON_KEY"), Relation.D_PERSON.column("PERSON_KEY"), JoinType.INNER));
        }
        for (Dimension dimension : Dimension.values()) {
            if (predicate.requiredDimensions().contains(dimension)) {
                joins.addAll(dimension.joins(JoinType.INNER));
            }
        }
        for (Dimension dimension : Dimension.values()) {
            if (predicate.joinedDimensions().contains(dimension) && !predicate.requiredDimensions().contains(dimension)) {
                joins.addAll(dimension.joins(JoinType.LEFT));
            }
        }
        return joins;
    }
}
