package edu.harvard.hms.dbmi.avillach.cohort.data.filter;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Boolean filter tree handed to the warehouse as part of a query description. Comparisons against a missing value never match.
 */
public sealed interface FilterExpression {

    /**
     * Every relation whose columns this filter reads.
     */
    Set<Relation> relations();

    record And(List<FilterExpression> operands) implements FilterExpression {
        public And {
            operands = ImmutableList.copyOf(operands);
        }

        @Override
        public Set<Relation> relations() {
            return operands.stream().flatMap(operand -> operand.relations().stream()).collect(Collectors.toCollection(TreeSet::new));
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    record Or(List<FilterExpression> operands) implements FilterExpression {
        public Or {
            operands = ImmutableList.copyOf(operands);
        }

        @Override
        public Set<Relation> relations() {
            return operands.stream().flatMap(operand -> operand.relations().stream()).collect(Collectors.toCollection(TreeSet::new));
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
        }
    }

    record Not(FilterExpression operand) implements FilterExpression {
        @Override
        public Set<Relation> relations() {
            return operand.relations();
        }

        @Override
        public String toString() {
            return "NOT " + operand;
        }
    }

    record Comparison(ColumnRef column, ComparisonOperator operator, Object value) implements FilterExpression {
        @Override
        public Set<Relation> relations() {
            return Set.of(column.relation());
        }

        @Override
        public String toString() {
            return column + " " + operator.getSymbol() + " " + value;
        }
    }

    record Like(ColumnRef column, String pattern, boolean caseInsensitive) implements FilterExpression {
        @Override
        public Set<Relation> relations() {
            return Set.of(column.relation());
        }

        @Override
        public String toString() {
            return (caseInsensitive ? "UPPER(" + column + ") LIKE UPPER('" : column + " LIKE ('") + pattern + "')";
        }
    }

    record In(ColumnRef column, List<Object> values) implements FilterExpression {
        public In {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public Set<Relation> relations() {
            return Set.of(column.relation());
        }

        @Override
        public String toString() {
            return column + " IN " + values;
        }
    }

    record Always() implements FilterExpression {
        @Override
        public Set<Relation> relations() {
            return Set.of();
        }

        @Override
        public String toString() {
            return "TRUE";
        }
    }

    static FilterExpression always() {
        return new Always();
    }

    static FilterExpression like(ColumnRef column, String pattern) {
        return new Like(column, pattern, false);
    }

    static FilterExpression likeIgnoreCase(ColumnRef column, String pattern) {
        return new Like(column, pattern, true);
    }

    static FilterExpression compare(ColumnRef column, ComparisonOperator operator, Object value) {
        return new Comparison(column, operator, value);
    }

    /**
     * Conjunction that drops {@link Always} operands and flattens nested conjunctions.
     */
    static FilterExpression and(Collection<FilterExpression> operands) {
        List<FilterExpression> flattened = new ArrayList<>();
        for (FilterExpression operand : operands) {
            if (operand instanceof And and) {
                flattened.addAll(and.operands());
            } else if (!(operand instanceof Always)) {
                flattened.add(operand);
            }
        }
        if (flattened.isEmpty()) {
            return always();
        }
        return flattened.size() == 1 ? flattened.get(0) : new And(flattened);
    }

    static FilterExpression and(FilterExpression... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Disjunction that flattens nested disjunctions. Any {@link Always} operand makes the whole disjunction always true.
     */
    static FilterExpression or(Collection<FilterExpression> operands) {
        List<FilterExpression> flattened = new ArrayList<>();
        for (FilterExpression operand : operands) {
            if (operand instanceof Always) {
                return always();
            } else if (operand instanceof Or or) {
                flattened.addAll(or.operands());
            } else {
                flattened.add(operand);
            }
        }
        if (flattened.isEmpty()) {
            throw new IllegalArgumentException("A disjunction needs at least one operand");
        }
        return flattened.size() == 1 ? flattened.get(0) : new Or(flattened);
    }

    static FilterExpression or(FilterExpression... operands) {
        return or(Arrays.asList(operands));
    }
}
