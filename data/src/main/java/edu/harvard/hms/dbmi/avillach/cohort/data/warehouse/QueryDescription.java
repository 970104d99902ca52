package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a {@link WarehouseClient} needs to run one query: the base relation, the relations joined onto it, a filter, and the
 * columns to return. {@code identifierColumn} is the column restricted by included identifiers and returned by identifier
 * queries.
 */
public record QueryDescription(
    Relation baseRelation, List<Join> joins, FilterExpression filter, List<ColumnRef> projection, ColumnRef identifierColumn,
    boolean distinct
) {

    public QueryDescription {
        joins = ImmutableList.copyOf(joins);
        projection = ImmutableList.copyOf(projection);
        if (filter == null) {
            filter = FilterExpression.always();
        }
    }

    public List<String> outputColumns() {
        return ColumnRef.outputNames(projection);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("SELECT ");
        if (distinct) {
            builder.append("DISTINCT ");
        }
        builder.append(projection.stream().map(ColumnRef::qualifiedName).collect(Collectors.joining(", ")));
        builder.append(" FROM ").append(baseRelation);
        for (Join join : joins) {
            builder.append(join.type() == JoinType.LEFT ? " LEFT JOIN " : " JOIN ").append(join.relation()).append(" ON ")
                .append(join.existing()).append(" = ").append(join.joined());
        }
        return builder.append(" WHERE ").append(filter).toString();
    }
}
