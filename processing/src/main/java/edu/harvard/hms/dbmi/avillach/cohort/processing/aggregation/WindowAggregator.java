package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.JoinType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

import static edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns.INDEX;
import static edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns.TIME_DELTA_IN_DAYS;

/**
 * Aggregates temporally joined event rows over time windows relative to their anchor.
 */
@Component
public class WindowAggregator {

    private static final Logger log = LoggerFactory.getLogger(WindowAggregator.class);

    /**
     * One table per window, in window order. Each holds the occurrence index and one column per aggregated column, named
     * {@code {column}_{interval}} or just the interval name when {@code prefixColumns} is false.
     *
     * @param table rows carrying the occurrence index and {@code time_delta_in_days}
     * @param aggregations aggregated column to aggregation, in output order
     */
    public List<Table> aggregateOverWindows(
        Table table, List<TimeWindow> windows, Map<String, AggregationFunction> aggregations, String name, boolean prefixColumns
    ) {
        OccurrenceColumns.requireIndex(table);
        if (!table.hasColumn(TIME_DELTA_IN_DAYS)) {
            throw new IllegalArgumentException("Table must include " + TIME_DELTA_IN_DAYS);
        }
        if (aggregations == null || aggregations.isEmpty()) {
            throw new IllegalArgumentException("At least one aggregation is required");
        }
        if (!prefixColumns && aggregations.size() > 1) {
            throw new IllegalArgumentException("Unprefixed column names need exactly one aggregated column");
        }
        aggregations.keySet().forEach(table::indexOf);

        List<String> deduplicated = new ArrayList<>(INDEX);
        deduplicated.add(TIME_DELTA_IN_DAYS);
        aggregations.keySet().stream().filter(column -> !deduplicated.contains(column)).forEach(deduplicated::add);

        List<Table> results = new ArrayList<>();
        for (TimeWindow window : windows) {
            Table clipped = table.filter(row -> window.contains(row.getInteger(TIME_DELTA_IN_DAYS))).select(deduplicated).distinct();
            String intervalName = window.intervalName(name);

            List<String> columns = new ArrayList<>(INDEX);
            aggregations.keySet().forEach(column -> columns.add(prefixColumns ? column + "_" + intervalName : intervalName));

            Map<List<Object>, List<Table.Row>> groups = new LinkedHashMap<>();
            for (Table.Row row : clipped.rows()) {
                groups.computeIfAbsent(Arrays.asList(row.get(INDEX.get(0)), row.get(INDEX.get(1))), key -> new ArrayList<>()).add(row);
            }

            Table.Builder aggregated = Table.builder(columns);
            groups.forEach((key, rows) -> {
                List<Object> values = new ArrayList<>(key);
                aggregations.forEach((column, function) -> values.add(function.apply(rows.stream().map(row -> row.get(column)).toList())));
                aggregated.addRow(values);
            });
            Table result = aggregated.build();
            log.debug("Window {} of {} aggregated {} rows into {}", window, name, clipped.size(), result.size());
            results.add(result);
        }
        return results;
    }

    /**
     * Left joins every non-empty table onto the base along the occurrence index.
     */
    public Table mergeToBase(Table base, List<Table> tables) {
        OccurrenceColumns.requireIndex(base);
        Table merged = base;
        for (Table table : tables) {
            if (table == null || table.isEmpty()) {
                continue;
            }
            merged = merged.join(table, INDEX, JoinType.LEFT, "");
        }
        return merged;
    }
}
