package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.*;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.QueryDescription;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.WarehouseClient;
import edu.harvard.hms.dbmi.avillach.cohort.exception.IncompatibleCombinationException;
import edu.harvard.hms.dbmi.avillach.cohort.processing.ResolutionCache.CacheKey;
import edu.harvard.hms.dbmi.avillach.cohort.processing.util.SetUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolves predicate trees to identifier sets and data tables. Every resolution is memoized in the {@link ResolutionCache};
 * disjunctions of unresolved predicates over the same base relation are answered with one merged query.
 */
@Component
public class ConditionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConditionEngine.class);

    public static final int EXAMPLE_ROWS = 10;

    public static final String COUNT_COLUMN = "count";

    private final WarehouseClient warehouseClient;

    private final QueryPlanner queryPlanner;

    private final ResolutionCache resolutionCache;

    @Autowired
    public ConditionEngine(WarehouseClient warehouseClient, QueryPlanner queryPlanner, ResolutionCache resolutionCache) {
        this.warehouseClient = warehouseClient;
        this.queryPlanner = queryPlanner;
        this.resolutionCache = resolutionCache;
    }

    public Set<String> resolveIdentifiers(Predicate predicate) {
        return resolveIdentifiers(predicate, null);
    }

    /**
     * @param limit keep only this many identifiers, the lowest ones, or all of them when null
     */
    public Set<String> resolveIdentifiers(Predicate predicate, Integer limit) {
        requirePredicate(predicate);
        requireLimit(limit);
        if (!predicate.identifierCache().isEmpty()) {
            return Collections.unmodifiableSet(SetUtils.limit(predicate.identifierCache(), limit));
        }
        return resolutionCache.identifiers(CacheKey.of(predicate, null, limit), () -> computeIdentifiers(predicate, limit));
    }

    private Set<String> computeIdentifiers(Predicate predicate, Integer limit) {
        if (predicate instanceof DatabasePredicate database) {
            return queryIdentifiers(database, limit);
        } else if (predicate instanceof CompositePredicate composite) {
            if (isMergeable(composite)) {
                MergedCriterion merged = ClauseMerger.merge((DatabasePredicate) composite.getLeft(), (DatabasePredicate) composite.getRight());
                log.debug("Merged {} into a single query", composite.label());
                return queryIdentifiers(merged, limit);
            }
            Set<String> left = resolveIdentifiers(composite.getLeft());
            Set<String> right = resolveIdentifiers(composite.getRight());
            Set<String> combined =
                composite.getOperator() == Operator.OR ? SetUtils.union(left, right) : SetUtils.intersection(left, right);
            return Collections.unmodifiableSet(SetUtils.limit(combined, limit));
        }
        return Set.of();
    }

    private boolean isMergeable(CompositePredicate composite) {
        return composite.getOperator() == Operator.OR && ClauseMerger.canMerge(composite.getLeft(), composite.getRight())
            && !isResolved(composite.getLeft()) && !isResolved(composite.getRight());
    }

    /**
     * True when the identifiers of {@code predicate} are known without another warehouse query.
     */
    public boolean isResolved(Predicate predicate) {
        return !predicate.identifierCache().isEmpty() || resolutionCache.cachedIdentifiers(CacheKey.of(predicate, null, null)).isPresent();
    }

    private Set<String> queryIdentifiers(DatabasePredicate predicate, Integer limit) {
        QueryDescription query = queryPlanner.identifierQuery(predicate);
        log.info("Resolving identifiers for {}", predicate.label());
        log.debug("Identifier query: {}", query);
        Set<String> identifiers = warehouseClient.resolveIdentifierQuery(query, limit);
        if (identifiers == null) {
            log.warn("Warehouse returned no identifier set for {}, treating it as empty", predicate.label());
            return Set.of();
        }
        return Collections.unmodifiableSet(new TreeSet<>(identifiers));
    }

    public Table resolveData(Predicate predicate) {
        return resolveData(predicate, null, null);
    }

    /**
     * @param includeIdentifiers only fetch rows of these subjects, or of all subjects when null
     * @param limit maximum number of rows, or all rows when null
     * @throws IncompatibleCombinationException when {@code predicate} combines predicates that cannot be fetched as one table
     */
    public Table resolveData(Predicate predicate, Set<String> includeIdentifiers, Integer limit) {
        requirePredicate(predicate);
        requireLimit(limit);
        if (includeIdentifiers != null && includeIdentifiers.isEmpty()) {
            return Table.empty(outputColumns(predicate));
        }
        return resolutionCache.data(
            CacheKey.of(predicate, includeIdentifiers, limit), () -> computeData(predicate, includeIdentifiers, limit)
        );
    }

    private Table computeData(Predicate predicate, Set<String> includeIdentifiers, Integer limit) {
        if (predicate instanceof IdentifierListPredicate identifiers) {
            Table table = identifiers.toTable();
            if (includeIdentifiers != null) {
                table = table.filter(row -> includeIdentifiers.contains(row.getString(OccurrenceColumns.MEDICAL_RECORD_NUMBER)));
            }
            return limit == null ? table : table.limit(limit);
        } else if (predicate instanceof DatabasePredicate database) {
            return queryData(database, includeIdentifiers, limit);
        }
        CompositePredicate composite = (CompositePredicate) predicate;
        DatabasePredicate merged = dataPredicate(composite);
        Set<String> identifiers = resolveIdentifiers(composite);
        Set<String> restriction = includeIdentifiers == null ? identifiers : SetUtils.intersection(includeIdentifiers, identifiers);
        if (restriction.isEmpty()) {
            return Table.empty(outputColumns(merged));
        }
        return queryData(merged, restriction, limit);
    }

    /**
     * The single database predicate whose rows make up the data of {@code composite}.
     */
    private DatabasePredicate dataPredicate(CompositePredicate composite) {
        List<DatabasePredicate> leaves = new ArrayList<>();
        for (Predicate leaf : composite.leaves()) {
            if (!(leaf instanceof DatabasePredicate database)) {
                throw new IncompatibleCombinationException(
                    "Cannot fetch " + leaf.label() + " together with other predicates, fetch the data of each side separately"
                );
            }
            leaves.add(database);
        }
        Set<Relation> relations = leaves.stream().map(DatabasePredicate::baseRelation).collect(Collectors.toCollection(TreeSet::new));
        if (relations.size() > 1) {
            throw new IncompatibleCombinationException(
                "Cannot fetch data across " + relations + " as a single table, fetch the data of each side separately"
            );
        }
        return ClauseMerger.mergeAll(leaves);
    }

    private Table queryData(DatabasePredicate predicate, Set<String> includeIdentifiers, Integer limit) {
        QueryDescription query = queryPlanner.dataQuery(predicate);
        log.info("Fetching data for {}", predicate.label());
        log.debug("Data query: {}", query);
        Table table = warehouseClient.resolveDataQuery(query, includeIdentifiers, limit);
        if (table == null) {
            log.warn("Warehouse returned no table for {}, treating it as empty", predicate.label());
            return Table.empty(outputColumns(predicate));
        }
        return table;
    }

    private List<String> outputColumns(Predicate predicate) {
        if (predicate instanceof DatabasePredicate database) {
            return ColumnRef.outputNames(database.projectionColumns());
        } else if (predicate instanceof CompositePredicate composite) {
            return outputColumns(dataPredicate(composite));
        }
        return OccurrenceColumns.INDEX;
    }

    /**
     * Distinct (identifier, age in days) pairs of the events matched by {@code predicate}.
     */
    public Table resolveOccurrences(Predicate predicate, Set<String> includeIdentifiers) {
        Table data = resolveData(predicate, includeIdentifiers, null);
        OccurrenceColumns.requireIndex(data);
        return data.select(OccurrenceColumns.INDEX).distinct();
    }

    /**
     * Combines two predicates. Disjunctions of predicates over the same base relation whose identifiers are not resolved yet
     * become a single merged criterion.
     */
    public Predicate combine(Predicate left, Predicate right, Operator operator) {
        requirePredicate(left);
        requirePredicate(right);
        if (operator == Operator.OR && ClauseMerger.canMerge(left, right) && !isResolved(left) && !isResolved(right)) {
            return ClauseMerger.merge((DatabasePredicate) left, (DatabasePredicate) right);
        }
        return new CompositePredicate(operator, left, right);
    }

    public Table exampleValues(Predicate predicate) {
        return resolveData(predicate, null, EXAMPLE_ROWS);
    }

    public Table distinctValues(Predicate predicate, String... columns) {
        return resolveData(predicate).select(columns).distinct();
    }

    /**
     * Number of rows per combination of values in {@code columns}, most frequent first.
     */
    public Table valuesPer(Predicate predicate, String... columns) {
        return countPer(resolveData(predicate).select(columns), Arrays.asList(columns));
    }

    /**
     * Number of distinct subjects per combination of values in {@code columns}, most frequent first.
     */
    public Table patientsPer(Predicate predicate, String... columns) {
        List<String> selected = new ArrayList<>(Arrays.asList(columns));
        selected.add(OccurrenceColumns.MEDICAL_RECORD_NUMBER);
        return countPer(resolveData(predicate).select(selected).distinct(), Arrays.asList(columns));
    }

    private static Table countPer(Table table, List<String> columns) {
        Map<List<Object>, Integer> counts = new LinkedHashMap<>();
        for (Table.Row row : table.rows()) {
            List<Object> key = columns.stream().map(row::get).collect(Collectors.toList());
            counts.merge(key, 1, Integer::sum);
        }
        List<String> resultColumns = new ArrayList<>(columns);
        resultColumns.add(COUNT_COLUMN);
        Table.Builder builder = Table.builder(resultColumns);
        counts.entrySet().stream().sorted(Map.Entry.<List<Object>, Integer>comparingByValue().reversed()).forEach(entry -> {
            List<Object> values = new ArrayList<>(entry.getKey());
            values.add(entry.getValue());
            builder.addRow(values);
        });
        return builder.build();
    }

    private static void requirePredicate(Predicate predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("A predicate is required");
        }
    }

    private static void requireLimit(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
    }
}
