package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Dimension;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import edu.harvard.hms.dbmi.avillach.cohort.exception.EmptyComparisonValueException;
import edu.harvard.hms.dbmi.avillach.cohort.exception.NotImplementedBehaviorException;
import edu.harvard.hms.dbmi.avillach.cohort.exception.UnsupportedChainingException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A leaf predicate: one kind of clinical criterion with its typed parameters, optional age constraints, at most one comparison on
 * the numeric value, and optionally a custom set of columns to fetch.
 */
public final class Criterion implements DatabasePredicate {

    private final CriterionKind kind;

    private final CriterionParameters parameters;

    private final List<AgeRange> ageRanges;

    private final ValueComparison comparison;

    private final List<ColumnRef> columns;

    private final String label;

    private volatile String structuralKey;

    public Criterion(CriterionKind kind, CriterionParameters parameters) {
        this(kind, parameters, List.of(), null, null, null);
    }

    private Criterion(
        CriterionKind kind, CriterionParameters parameters, List<AgeRange> ageRanges, ValueComparison comparison, List<ColumnRef> columns,
        String label
    ) {
        if (kind == null || parameters == null) {
            throw new IllegalArgumentException("A criterion needs a kind and parameters");
        }
        if (!kind.getParameterType().isInstance(parameters)) {
            throw new IllegalArgumentException(kind.getClassName() + " criteria take " + kind.getParameterType().getSimpleName());
        }
        this.kind = kind;
        this.parameters = parameters;
        this.ageRanges = ImmutableList.copyOf(ageRanges);
        this.comparison = comparison;
        this.columns = columns == null ? null : ImmutableList.copyOf(columns);
        this.label = label;
    }

    public CriterionKind getKind() {
        return kind;
    }

    public CriterionParameters getParameters() {
        return parameters;
    }

    public List<AgeRange> getAgeRanges() {
        return ageRanges;
    }

    public Optional<ValueComparison> getComparison() {
        return Optional.ofNullable(comparison);
    }

    public CriterionDomain getDomain() {
        return kind.getDomain();
    }

    /**
     * Restricts to events at an age between {@code minYears} (inclusive) and {@code maxYears} (exclusive). A year counts as 365
     * days.
     */
    public Criterion age(Integer minYears, Integer maxYears) {
        AgeRange range = AgeRange.ofYears(minYears, maxYears);
        return ageInDays(range.minDays(), range.maxDays());
    }

    public Criterion ageInDays(Integer minDays, Integer maxDays) {
        if (!getDomain().supportsAge()) {
            throw new NotImplementedBehaviorException(kind.getClassName() + " criteria do not support age constraints");
        }
        List<AgeRange> ranges = new ArrayList<>(ageRanges);
        ranges.add(new AgeRange(minDays, maxDays));
        return new Criterion(kind, parameters, ranges, comparison, columns, label);
    }

    public Criterion gt(Number value) {
        return compare(ComparisonOperator.GT, value);
    }

    public Criterion ge(Number value) {
        return compare(ComparisonOperator.GE, value);
    }

    public Criterion lt(Number value) {
        return compare(ComparisonOperator.LT, value);
    }

    public Criterion le(Number value) {
        return compare(ComparisonOperator.LE, value);
    }

    public Criterion eq(Number value) {
        return compare(ComparisonOperator.EQ, value);
    }

    public Criterion ne(Number value) {
        return compare(ComparisonOperator.NE, value);
    }

    /**
     * A missing {@code value} is accepted here and rejected once the filter is built.
     */
    public Criterion compare(ComparisonOperator operator, Number value) {
        if (!getDomain().supportsValueComparison()) {
            throw new NotImplementedBehaviorException(kind.getClassName() + " criteria have no numeric value to compare");
        }
        if (comparison != null) {
            throw new UnsupportedChainingException();
        }
        ValueComparison valueComparison = new ValueComparison(operator, value == null ? null : value.doubleValue());
        return new Criterion(kind, parameters, ageRanges, valueComparison, columns, label);
    }

    public Criterion withColumns(List<ColumnRef> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        return new Criterion(kind, parameters, ageRanges, comparison, columns, label);
    }

    /**
     * @param qualifiedNames columns such as {@code FACT.AGE_IN_DAYS}
     */
    public Criterion withColumns(String... qualifiedNames) {
        return withColumns(Arrays.stream(qualifiedNames).map(ColumnRef::parse).collect(Collectors.toList()));
    }

    @Override
    public Relation baseRelation() {
        return getDomain().getBaseRelation();
    }

    @Override
    public Set<Dimension> joinedDimensions() {
        return getDomain().getDimensions();
    }

    @Override
    public Set<Dimension> requiredDimensions() {
        return getDomain().getDimensions();
    }

    @Override
    public FilterExpression filter() {
        List<FilterExpression> filters = new ArrayList<>();
        filters.add(getDomain().getBaseFilter());
        filters.add(parameters.toFilter(getDomain()));
        for (AgeRange range : ageRanges) {
            if (range.minDays() != null) {
                filters.add(FilterExpression.compare(getDomain().ageColumn(), ComparisonOperator.GE, range.minDays()));
            }
            if (range.maxDays() != null) {
                filters.add(FilterExpression.compare(getDomain().ageColumn(), ComparisonOperator.LT, range.maxDays()));
            }
        }
        if (comparison != null) {
            if (comparison.value() == null) {
                throw new EmptyComparisonValueException(comparison.operator().getSymbol());
            }
            filters.add(FilterExpression.compare(getDomain().valueColumn(), comparison.operator(), comparison.value()));
        }
        return FilterExpression.and(filters);
    }

    @Override
    public List<ColumnRef> projectionColumns() {
        return columns == null ? getDomain().getDefaultColumns() : columns;
    }

    @Override
    public Map<String, Object> toDict() {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("class", kind.getClassName());
        dict.put("attributes", parameters.toAttributes());
        if (!ageRanges.isEmpty()) {
            List<Map<String, Object>> ages = new ArrayList<>();
            for (AgeRange range : ageRanges) {
                Map<String, Object> age = new LinkedHashMap<>();
                age.put("min_days", range.minDays());
                age.put("max_days", range.maxDays());
                ages.add(age);
            }
            dict.put("age_in_days", ages);
        }
        if (comparison != null) {
            Map<String, Object> compared = new LinkedHashMap<>();
            compared.put("operator", comparison.operator().key());
            compared.put("value", comparison.value());
            dict.put("comparison", compared);
        }
        if (columns != null) {
            dict.put("data_columns", columns.stream().map(ColumnRef::qualifiedName).collect(Collectors.toList()));
        }
        return dict;
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
    public Criterion withLabel(String label) {
        return new Criterion(kind, parameters, ageRanges, comparison, columns, label);
    }

    @Override
    public String label() {
        if (label != null) {
            return label;
        }
        String attributes = parameters.toAttributes().values().stream().filter(Objects::nonNull).map(Object::toString)
            .collect(Collectors.joining(" "));
        return attributes.isEmpty() ? kind.getClassName() : kind.getClassName() + " " + attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Criterion)) return false;
        return structuralKey().equals(((Criterion) o).structuralKey());
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
