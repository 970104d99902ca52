package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Reductions applied to a group of cell values. Null cells are ignored; an all-null group reduces to null, except for
 * {@link #COUNT} and {@link #ANY}.
 */
public enum AggregationFunction {
    MEAN,
    MEDIAN,
    MIN,
    MAX,
    SUM,
    COUNT,
    ANY,
    MODE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AggregationFunction fromKey(String key) {
        for (AggregationFunction function : values()) {
            if (function.key().equalsIgnoreCase(key)) {
                return function;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation: " + key);
    }

    public Object apply(List<?> values) {
        List<Object> present = values.stream().filter(Objects::nonNull).collect(Collectors.toList());
        switch (this) {
            case COUNT:
                return present.size();
            case ANY:
                return !present.isEmpty();
            case MODE:
                return mode(present);
            default:
                break;
        }
        if (present.isEmpty()) {
            return null;
        }
        double[] numbers = present.stream().mapToDouble(AggregationFunction::toDouble).sorted().toArray();
        switch (this) {
            case MEAN:
                return Arrays.stream(numbers).average().orElseThrow();
            case MEDIAN:
                int middle = numbers.length / 2;
                return numbers.length % 2 == 1 ? numbers[middle] : (numbers[middle - 1] + numbers[middle]) / 2;
            case MIN:
                return numbers[0];
            case MAX:
                return numbers[numbers.length - 1];
            case SUM:
                return Arrays.stream(numbers).sum();
            default:
                throw new IllegalStateException("Unhandled aggregation " + this);
        }
    }

    // Ties resolve to the value seen first.
    private static Object mode(List<Object> present) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        present.forEach(value -> counts.merge(value, 1, Integer::sum));
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1 : 0;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot aggregate non-numeric value " + value, e);
        }
    }
}
