package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Evaluates query descriptions over rows held in memory, one list of rows per relation. Useful for tests and for small
 * extracts; it keeps count of every query it executes.
 */
public class InMemoryWarehouseClient implements WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWarehouseClient.class);

    private final Map<Relation, List<Map<String, Object>>> relations = new ConcurrentHashMap<>();

    private final Map<String, Pattern> likePatterns = new ConcurrentHashMap<>();

    private final List<QueryDescription> executedQueries = new CopyOnWriteArrayList<>();

    private final AtomicInteger identifierQueryCount = new AtomicInteger();

    private final AtomicInteger dataQueryCount = new AtomicInteger();

    /**
     * Adds one row to a relation. Columns missing from {@code row} are null.
     */
    public InMemoryWarehouseClient insert(Relation relation, Map<String, Object> row) {
        Map<String, Object> stored = new HashMap<>();
        row.forEach((column, value) -> stored.put(relation.column(column.toUpperCase(Locale.ROOT)).name(), value));
        relations.computeIfAbsent(relation, r -> new CopyOnWriteArrayList<>()).add(stored);
        return this;
    }

    @Override
    public Set<String> resolveIdentifierQuery(QueryDescription query, Integer limit) {
        identifierQueryCount.incrementAndGet();
        executedQueries.add(query);
        log.debug("Resolving identifiers: {}", query);

        TreeSet<String> identifiers = evaluate(query, null).stream().map(row -> row.get(query.identifierColumn()))
            .filter(Objects::nonNull).map(Object::toString).collect(Collectors.toCollection(TreeSet::new));
        if (limit == null) {
            return identifiers;
        }
        return identifiers.stream().limit(limit).collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public Table resolveDataQuery(QueryDescription query, Set<String> includeIdentifiers, Integer limit) {
        dataQueryCount.incrementAndGet();
        executedQueries.add(query);
        log.debug("Resolving data for {} identifiers: {}", includeIdentifiers == null ? "all" : includeIdentifiers.size(), query);

        List<String> columns = query.outputColumns();
        Map<String, List<ColumnRef>> sources = new LinkedHashMap<>();
        query.projection().forEach(column -> sources.computeIfAbsent(column.outputName(), name -> new ArrayList<>()).add(column));
        Table.Builder builder = Table.builder(columns);
        for (Map<ColumnRef, Object> row : evaluate(query, includeIdentifiers)) {
            builder.addRow(columns.stream().map(name -> firstNonNull(row, sources.get(name))).collect(Collectors.toList()));
        }
        Table table = builder.build();
        if (query.distinct()) {
            table = table.distinct();
        }
        return limit == null ? table : table.limit(limit);
    }

    private static Object firstNonNull(Map<ColumnRef, Object> row, List<ColumnRef> columns) {
        for (ColumnRef column : columns) {
            Object value = row.get(column);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private List<Map<ColumnRef, Object>> evaluate(QueryDescription query, Set<String> includeIdentifiers) {
        List<Map<ColumnRef, Object>> rows = new ArrayList<>();
        for (Map<String, Object> base : relations.getOrDefault(query.baseRelation(), List.of())) {
            rows.add(qualify(query.baseRelation(), base));
        }
        for (Join join : query.joins()) {
            rows = join(rows, join);
        }
        return rows.stream().filter(row -> matches(query.filter(), row)).filter(row -> {
            if (includeIdentifiers == null) {
                return true;
            }
            Object identifier = row.get(query.identifierColumn());
            return identifier != null && includeIdentifiers.contains(identifier.toString());
        }).collect(Collectors.toList());
    }

    private List<Map<ColumnRef, Object>> join(List<Map<ColumnRef, Object>> rows, Join join) {
        List<Map<String, Object>> candidates = relations.getOrDefault(join.relation(), List.of());
        List<Map<ColumnRef, Object>> joined = new ArrayList<>();
        for (Map<ColumnRef, Object> row : rows) {
            Object key = row.get(join.existing());
            boolean matched = false;
            for (Map<String, Object> candidate : candidates) {
                Object candidateKey = candidate.get(join.joined().name());
                if (key != null && key.equals(candidateKey)) {
                    Map<ColumnRef, Object> combined = new HashMap<>(row);
                    combined.putAll(qualify(join.relation(), candidate));
                    joined.add(combined);
                    matched = true;
                }
            }
            if (!matched && join.type() == JoinType.LEFT) {
                joined.add(row);
            }
        }
        return joined;
    }

    private static Map<ColumnRef, Object> qualify(Relation relation, Map<String, Object> row) {
        Map<ColumnRef, Object> qualified = new HashMap<>();
        row.forEach((column, value) -> qualified.put(new ColumnRef(relation, column), value));
        return qualified;
    }

    private boolean matches(FilterExpression filter, Map<ColumnRef, Object> row) {
        if (filter instanceof FilterExpression.Always) {
            return true;
        } else if (filter instanceof FilterExpression.And and) {
            return and.operands().stream().allMatch(operand -> matches(operand, row));
        } else if (filter instanceof FilterExpression.Or or) {
            return or.operands().stream().anyMatch(operand -> matches(operand, row));
        } else if (filter instanceof FilterExpression.Not not) {
            return !matches(not.operand(), row);
        } else if (filter instanceof FilterExpression.Like like) {
            Object value = row.get(like.column());
            return value != null && likePattern(like.pattern(), like.caseInsensitive()).matcher(value.toString()).matches();
        } else if (filter instanceof FilterExpression.In in) {
            Object value = row.get(in.column());
            return value != null && in.values().stream().anyMatch(candidate -> compare(value, candidate) == 0);
        } else if (filter instanceof FilterExpression.Comparison comparison) {
            Object value = row.get(comparison.column());
            return value != null && comparison.value() != null && comparison.operator().accepts(compare(value, comparison.value()));
        }
        throw new IllegalArgumentException("Unsupported filter " + filter);
    }

    private Pattern likePattern(String pattern, boolean caseInsensitive) {
        return likePatterns.computeIfAbsent((caseInsensitive ? "i:" : "s:") + pattern, key -> {
            StringBuilder regex = new StringBuilder();
            for (char c : pattern.toCharArray()) {
                if (c == '%') {
                    regex.append(".*");
                } else if (c == '_') {
                    regex.append('.');
                } else {
                    regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            return caseInsensitive ? Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
                : Pattern.compile(regex.toString(), Pattern.DOTALL);
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object value, Object operand) {
        if (value instanceof Number number && operand instanceof Number other) {
            return Double.compare(number.doubleValue(), other.doubleValue());
        }
        if (value.getClass().equals(operand.getClass()) && value instanceof Comparable comparable) {
            return comparable.compareTo(operand);
        }
        return value.toString().compareTo(operand.toString());
    }

    public int getIdentifierQueryCount() {
        return identifierQueryCount.get();
    }

    public int getDataQueryCount() {
        return dataQueryCount.get();
    }

    public int getQueryCount() {
        return identifierQueryCount.get() + dataQueryCount.get();
    }

    public List<QueryDescription> getExecutedQueries() {
        return List.copyOf(executedQueries);
    }
}
