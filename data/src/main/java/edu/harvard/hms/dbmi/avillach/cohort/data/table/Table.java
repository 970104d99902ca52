package edu.harvard.hms.dbmi.avillach.cohort.data.table;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.JoinType;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable, row oriented result table. Column names are normalized to lower case on construction, cells may be null.
 */
public final class Table {

    private final List<String> columns;

    private final Map<String, Integer> columnIndex;

    private final List<List<Object>> rows;

    public Table(List<String> columns, List<List<Object>> rows) {
        ImmutableList.Builder<String> normalized = ImmutableList.builder();
        Map<String, Integer> index = new HashMap<>();
        for (String column : columns) {
            String name = column.toLowerCase(Locale.ROOT);
            if (index.put(name, index.size()) != null) {
                throw new IllegalArgumentException("Duplicate column " + name);
            }
            normalized.add(name);
        }
        this.columns = normalized.build();
        this.columnIndex = Collections.unmodifiableMap(index);

        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("Row " + row + " does not match columns " + this.columns);
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public int indexOf(String column) {
        Integer index = columnIndex.get(column);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column " + column + ", available columns are " + columns);
        }
        return index;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Row> rows() {
        List<Row> views = new ArrayList<>(rows.size());
        for (List<Object> values : rows) {
            views.add(new Row(values));
        }
        return views;
    }

    public Row row(int index) {
        return new Row(rows.get(index));
    }

    public List<Object> column(String column) {
        int index = indexOf(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public Table select(String... columns) {
        return select(Arrays.asList(columns));
    }

    public Table select(List<String> selected) {
        int[] indexes = selected.stream().mapToInt(this::indexOf).toArray();
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(indexes.length);
            for (int index : indexes) {
                values.add(row.get(index));
            }
            projected.add(values);
        }
        return new Table(selected, projected);
    }

    public Table drop(String... dropped) {
        Set<String> excluded = new HashSet<>(Arrays.asList(dropped));
        return select(columns.stream().filter(column -> !excluded.contains(column)).collect(Collectors.toList()));
    }

    public Table rename(Map<String, String> renames) {
        List<String> renamed = columns.stream().map(column -> renames.getOrDefault(column, column)).collect(Collectors.toList());
        return new Table(renamed, rows);
    }

    public Table filter(Predicate<Row> predicate) {
        return new Table(columns, rows.stream().filter(row -> predicate.test(new Row(row))).collect(Collectors.toList()));
    }

    /**
     * Removes duplicate rows, keeping the first occurrence of each.
     */
    public Table distinct() {
        return new Table(columns, new ArrayList<>(new LinkedHashSet<>(rows)));
    }

    public Table limit(int limit) {
        return rows.size() <= limit ? this : new Table(columns, rows.subList(0, limit));
    }

    /**
     * Adds a derived column, or replaces it when a column of that name exists.
     */
    public Table withColumn(String column, Function<Row, Object> derivation) {
        String name = column.toLowerCase(Locale.ROOT);
        boolean replace = hasColumn(name);
        List<String> resultColumns = new ArrayList<>(columns);
        if (!replace) {
            resultColumns.add(name);
        }
        List<List<Object>> derived = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(row);
            Object value = derivation.apply(new Row(row));
            if (replace) {
                values.set(indexOf(name), value);
            } else {
                values.add(value);
            }
            derived.add(values);
        }
        return new Table(resultColumns, derived);
    }

    /**
     * Hash join on equal key values. Non-key columns of {@code right} that clash with columns of this table are prefixed with
     * {@code clashPrefix}. Rows with a null key never match.
     */
    public Table join(Table right, List<String> keys, JoinType type, String clashPrefix) {
        int[] leftKeys = keys.stream().mapToInt(this::indexOf).toArray();
        int[] rightKeys = keys.stream().mapToInt(right::indexOf).toArray();

        List<String> resultColumns = new ArrayList<>(columns);
        List<Integer> rightCarried = new ArrayList<>();
        for (int i = 0; i < right.columns.size(); i++) {
            String column = right.columns.get(i);
            if (keys.contains(column)) {
                continue;
            }
            String name = hasColumn(column) ? clashPrefix + column : column;
            if (resultColumns.contains(name)) {
                throw new IllegalArgumentException("Column " + name + " is present on both sides of the join");
            }
            resultColumns.add(name);
            rightCarried.add(i);
        }

        Map<List<Object>, List<List<Object>>> rightByKey = new HashMap<>();
        for (List<Object> row : right.rows) {
            List<Object> key = keyOf(row, rightKeys);
            if (key != null) {
                rightByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        List<List<Object>> joined = new ArrayList<>();
        for (List<Object> row : rows) {
            List<Object> key = keyOf(row, leftKeys);
            List<List<Object>> matches = key == null ? List.of() : rightByKey.getOrDefault(key, List.of());
            if (matches.isEmpty() && type == JoinType.LEFT) {
                List<Object> values = new ArrayList<>(row);
                rightCarried.forEach(i -> values.add(null));
                joined.add(values);
            }
            for (List<Object> match : matches) {
                List<Object> values = new ArrayList<>(row);
                rightCarried.forEach(i -> values.add(match.get(i)));
                joined.add(values);
            }
        }
        return new Table(resultColumns, joined);
    }

    private static List<Object> keyOf(List<Object> row, int[] keyIndexes) {
        List<Object> key = new ArrayList<>(keyIndexes.length);
        for (int index : keyIndexes) {
            Object value = row.get(index);
            if (value == null) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Table table = (Table) o;
        return columns.equals(table.columns) && rows.equals(table.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table" + columns + " (" + rows.size() + " rows)";
    }

    /**
     * Read only view of one row.
     */
    public final class Row {

        private final List<Object> values;

        private Row(List<Object> values) {
            this.values = values;
        }

        public Object get(String column) {
            return values.get(indexOf(column));
        }

        public List<Object> values() {
            return values;
        }

        public String getString(String column) {
            Object value = get(column);
            return value == null ? null : value.toString();
        }

        public Double getDouble(String column) {
            Object value = get(column);
            if (value == null || value instanceof Double) {
                return (Double) value;
            }
            return value instanceof Number number ? number.doubleValue() : Double.valueOf(value.toString());
        }

        public Integer getInteger(String column) {
            Object value = get(column);
            if (value == null || value instanceof Integer) {
                return (Integer) value;
            }
            return value instanceof Number number ? number.intValue() : Integer.valueOf(value.toString());
        }
    }

    public static final class Builder {

        private final List<String> columns;

        private final List<List<Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = columns;
        }

        public Builder addRow(Object... values) {
            rows.add(Arrays.asList(values));
            return this;
        }

        public Builder addRow(List<Object> values) {
            rows.add(values);
            return this;
        }

        public Table build() {
            return new Table(columns, rows);
        }
    }
}
