package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.CriterionKind;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns long event tables into one feature column per pivot value.
 */
@Component
public class FeaturePivot {

    private static final Logger log = LoggerFactory.getLogger(FeaturePivot.class);

    public static final String DELIMITER = "__";

    public static final String CODE_COLUMN = "code";

    public static final String CONTEXT_COLUMN = "context_name";

    private final double defaultFillThreshold;

    @Autowired
    public FeaturePivot(@Value("${COHORT_PIVOT_FILL_THRESHOLD:0.5}") double defaultFillThreshold) {
        this.defaultFillThreshold = requireThreshold(defaultFillThreshold);
        log.info("Pivoted feature columns need a fill ratio of at least {}", defaultFillThreshold);
    }

    public double getDefaultFillThreshold() {
        return defaultFillThreshold;
    }

    public Table pivot(Table table, List<String> indexColumns, PivotConfiguration configuration) {
        double threshold = configuration.fillThreshold() == null ? defaultFillThreshold : configuration.fillThreshold();
        return pivotToFeatureTable(table, indexColumns, configuration.pivotColumn(), configuration.aggregations(), threshold);
    }

    public Table pivotToFeatureTable(
        Table table, List<String> indexColumns, String pivotColumn, Map<String, List<AggregationFunction>> aggregations
    ) {
        return pivotToFeatureTable(table, indexColumns, pivotColumn, aggregations, defaultFillThreshold);
    }

    /**
     * One row per distinct index, one column per pivot value and aggregation, named {@code {value}__{aggregation}__{pivot}}. The
     * aggregation level is left out when a single aggregation is requested overall, and names are lower-cased like every table
     * column. Cells without any event stay null, and feature
     * columns with fewer non-null cells than {@code fillThreshold} times the row count are dropped.
     */
    public Table pivotToFeatureTable(
        Table table, List<String> indexColumns, String pivotColumn, Map<String, List<AggregationFunction>> aggregations,
        double fillThreshold
    ) {
        requireThreshold(fillThreshold);
        if (indexColumns == null || indexColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one index column is required");
        }
        if (aggregations == null || aggregations.values().stream().mapToInt(List::size).sum() == 0) {
            throw new IllegalArgumentException("At least one aggregation is required");
        }
        indexColumns.forEach(table::indexOf);
        table.indexOf(pivotColumn);
        aggregations.keySet().forEach(table::indexOf);
        boolean singleAggregation = aggregations.values().stream().mapToInt(List::size).sum() == 1;

        Map<List<Object>, Map<String, List<Table.Row>>> groups = new LinkedHashMap<>();
        SortedSet<String> pivotValues = new TreeSet<>();
        for (Table.Row row : table.rows()) {
            String pivotValue = row.getString(pivotColumn);
            if (pivotValue == null) {
                continue;
            }
            pivotValues.add(pivotValue);
            List<Object> key = indexColumns.stream().map(row::get).toList();
            groups.computeIfAbsent(key, k -> new HashMap<>()).computeIfAbsent(pivotValue, v -> new ArrayList<>()).add(row);
        }

        List<String> featureColumns = new ArrayList<>();
        List<Feature> features = new ArrayList<>();
        aggregations.forEach((valueColumn, functions) -> functions.forEach(function -> pivotValues.forEach(pivotValue -> {
            String name = singleAggregation
                ? String.join(DELIMITER, valueColumn, pivotValue)
                : String.join(DELIMITER, valueColumn, function.key(), pivotValue);
            featureColumns.add(name.toLowerCase(Locale.ROOT));
            features.add(new Feature(valueColumn, function, pivotValue));
        })));

        List<List<Object>> rows = new ArrayList<>();
        int[] filled = new int[features.size()];
        groups.forEach((key, byPivotValue) -> {
            List<Object> values = new ArrayList<>(key);
            for (int i = 0; i < features.size(); i++) {
                Feature feature = features.get(i);
                List<Table.Row> events = byPivotValue.get(feature.pivotValue());
                Object value = events == null ? null : feature.function().apply(events.stream().map(row -> row.get(feature.valueColumn())).toList());
                if (value != null) {
                    filled[i]++;
                }
                values.add(value);
            }
            rows.add(values);
        });

        List<String> columns = new ArrayList<>(indexColumns);
        columns.addAll(featureColumns);
        Table wide = new Table(columns, rows);

        List<String> dropped = new ArrayList<>();
        for (int i = 0; i < featureColumns.size(); i++) {
            if (filled[i] < rows.size() * fillThreshold) {
                dropped.add(featureColumns.get(i));
            }
        }
        log.debug("Pivoted {} rows on {} into {} features, {} below the fill threshold of {}", table.size(), pivotColumn,
            featureColumns.size(), dropped.size(), fillThreshold);
        return dropped.isEmpty() ? wide : wide.drop(dropped.toArray(new String[0]));
    }

    /**
     * Replaces the context column and the first {@code *_code} column with a single {@code code} column of the form
     * {@code Kind__context__code}.
     */
    public static Table createIdColumn(CriterionKind kind, Table table) {
        String codeColumn = table.getColumns().stream()
            .filter(column -> column.endsWith("_code"))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No code column in " + table.getColumns()));
        table.indexOf(CONTEXT_COLUMN);
        return table
            .withColumn(CODE_COLUMN, row -> String.join(DELIMITER, kind.getClassName(),
                String.valueOf(row.get(CONTEXT_COLUMN)), String.valueOf(row.get(codeColumn))))
            .drop(CONTEXT_COLUMN, codeColumn);
    }

    private static double requireThreshold(double threshold) {
        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Fill threshold must be between 0 and 1, was " + threshold);
        }
        return threshold;
    }

    private record Feature(String valueColumn, AggregationFunction function, String pivotValue) {
    }
}
