package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * How to widen the events of one criterion kind: the column whose values become features, the aggregations per value column,
 * and an optional fill threshold overriding the configured default.
 */
public record PivotConfiguration(String pivotColumn, Map<String, List<AggregationFunction>> aggregations, Double fillThreshold) {

    public PivotConfiguration {
        if (pivotColumn == null || aggregations == null || aggregations.isEmpty()) {
            throw new IllegalArgumentException("A pivot column and at least one aggregation are required");
        }
        ImmutableMap.Builder<String, List<AggregationFunction>> copy = ImmutableMap.builder();
        aggregations.forEach((column, functions) -> copy.put(column, ImmutableList.copyOf(functions)));
        aggregations = copy.build();
    }

    public static PivotConfiguration of(String pivotColumn, String valueColumn, AggregationFunction... functions) {
        return new PivotConfiguration(pivotColumn, Map.of(valueColumn, List.of(functions)), null);
    }

    public PivotConfiguration withFillThreshold(double threshold) {
        return new PivotConfiguration(pivotColumn, aggregations, threshold);
    }
}
