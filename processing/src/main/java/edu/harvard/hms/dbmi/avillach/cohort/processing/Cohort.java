package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.Criteria;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.DatabasePredicate;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Operator;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.JoinType;
import edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation.AggregationFunction;
import edu.harvard.hms.dbmi.avillach.cohort.processing.temporal.TemporalJoinService;
import edu.harvard.hms.dbmi.avillach.cohort.processing.temporal.TemporalSelector;
import edu.harvard.hms.dbmi.avillach.cohort.processing.util.SetUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns.*;

/**
 * A population defined by a predicate. Membership is resolved on first use and kept; exclusions are applied on top of that
 * resolution and never cause another warehouse query.
 */
public class Cohort {

    private static final Logger log = LoggerFactory.getLogger(Cohort.class);

    public static final List<Integer> DEFAULT_ONSET_DELTAS = List.of(1, 7, 14, 28);

    public static final String NUMERIC_VALUE = "numeric_value";

    public static final String GENDER = "gender";

    /** Ages beyond this are placeholder values in the warehouse. */
    static final int MAXIMUM_AGE_IN_DAYS = 50000;

    private static final UnaryOperator<String> TRIM_AFTER_DOT = code -> code.split("\\.", -1)[0];

    private final ConditionEngine engine;

    private final TemporalJoinService temporalJoinService;

    private final Predicate predicate;

    private final Integer limit;

    private final Set<String> excluded = Collections.synchronizedSet(new TreeSet<>());

    private volatile Set<String> baseIdentifiers;

    public Cohort(ConditionEngine engine, TemporalJoinService temporalJoinService, Predicate predicate, Integer limit) {
        if (predicate == null) {
            throw new IllegalArgumentException("A cohort needs a defining predicate");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative, was " + limit);
        }
        this.engine = engine;
        this.temporalJoinService = temporalJoinService;
        this.predicate = predicate;
        this.limit = limit;
    }

    public Predicate getPredicate() {
        return predicate;
    }

    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    public Set<String> getExcluded() {
        synchronized (excluded) {
            return Set.copyOf(excluded);
        }
    }

    /**
     * Identifiers of the members, in ascending order.
     */
    public Set<String> identifiers() {
        Set<String> base = baseIdentifiers();
        synchronized (excluded) {
            return Collections.unmodifiableSet(new TreeSet<>(SetUtils.difference(base, excluded)));
        }
    }

    private Set<String> baseIdentifiers() {
        Set<String> resolved = baseIdentifiers;
        if (resolved == null) {
            synchronized (this) {
                resolved = baseIdentifiers;
                if (resolved == null) {
                    resolved = Set.copyOf(engine.resolveIdentifiers(predicate, limit));
                    baseIdentifiers = resolved;
                    log.debug("Cohort {} resolved to {} subjects", predicate.label(), resolved.size());
                }
            }
        }
        return resolved;
    }

    public int size() {
        return identifiers().size();
    }

    /**
     * Removes subjects from the cohort. Identifiers are compared by their string form.
     */
    public Cohort exclude(Collection<?> identifiers) {
        List<String> removed = identifiers.stream().map(String::valueOf).collect(Collectors.toList());
        excluded.addAll(removed);
        log.debug("Excluded {} subjects from cohort {}", removed.size(), predicate.label());
        return this;
    }

    /**
     * Data of {@code dataPredicate} for the members of this cohort.
     */
    public Table get(Predicate dataPredicate) {
        return getAll(List.of(dataPredicate), null).get(0);
    }

    public List<Table> getAll(Predicate... dataPredicates) {
        return getAll(Arrays.asList(dataPredicates), null);
    }

    /**
     * Fetches data for the members of this cohort. Database predicates over the same base relation are combined into one request
     * and yield one table; every other predicate yields a table of its own. Tables come in the order their first predicate was
     * given.
     *
     * @param limit maximum number of rows per table, or all rows when null
     */
    public List<Table> getAll(List<Predicate> dataPredicates, Integer limit) {
        if (dataPredicates == null || dataPredicates.isEmpty()) {
            throw new IllegalArgumentException("At least one data predicate is required");
        }
        Map<Object, List<Predicate>> groups = new LinkedHashMap<>();
        for (Predicate dataPredicate : dataPredicates) {
            Object group = dataPredicate instanceof DatabasePredicate database ? database.baseRelation() : new Object();
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(dataPredicate);
        }
        Set<String> members = identifiers();
        List<Table> tables = new ArrayList<>();
        for (List<Predicate> group : groups.values()) {
            Predicate combined = group.stream().reduce((left, right) -> engine.combine(left, right, Operator.OR)).orElseThrow();
            log.info("Fetching data for {} in cohort {}", combined.label(), predicate.label());
            tables.add(engine.resolveData(combined, members, limit));
        }
        return tables;
    }

    public Table occurs(Predicate target, TemporalSelector selector) {
        return occurs(target, selector, TRIM_AFTER_DOT);
    }

    /**
     * Target events of the members related in time to the anchor events of the selector. Columns whose name contains
     * {@code _code} are passed through {@code trimCode} on both sides before duplicates are removed.
     */
    public Table occurs(Predicate target, TemporalSelector selector, UnaryOperator<String> trimCode) {
        Table anchor = trimCodes(get(selector.anchor()), trimCode);
        Table events = trimCodes(get(target), trimCode);
        return temporalJoinService.joinOccurrences(anchor, events, selector.relation());
    }

    /**
     * Mean {@code numeric_value} of the target per occurrence, related in time to the anchor occurrences of the selector.
     * Columns are the occurrence index of the anchor, {@code numeric_value} and {@code time_delta_in_days}.
     */
    public Table valuesFor(Predicate target, TemporalSelector selector) {
        Table anchor = get(selector.anchor());
        OccurrenceColumns.requireIndex(anchor);
        Table values = get(target);
        OccurrenceColumns.requireIndex(values);
        values.indexOf(NUMERIC_VALUE);

        Map<List<Object>, List<Object>> byOccurrence = new LinkedHashMap<>();
        for (Table.Row row : values.rows()) {
            byOccurrence.computeIfAbsent(Arrays.asList(row.get(MEDICAL_RECORD_NUMBER), row.get(AGE_IN_DAYS)), k -> new ArrayList<>())
                .add(row.get(NUMERIC_VALUE));
        }
        Table.Builder means = Table.builder(MEDICAL_RECORD_NUMBER, AGE_IN_DAYS, NUMERIC_VALUE);
        byOccurrence.forEach((key, numbers) -> means.addRow(key.get(0), key.get(1), AggregationFunction.MEAN.apply(numbers)));

        Table joined = temporalJoinService.joinOccurrences(anchor.select(INDEX).distinct(), means.build(), selector.relation());
        return joined.select(MEDICAL_RECORD_NUMBER, AGE_IN_DAYS, NUMERIC_VALUE, TIME_DELTA_IN_DAYS);
    }

    public Table hasOnset(String name, Predicate condition) {
        return hasOnset(name, condition, DEFAULT_ONSET_DELTAS);
    }

    /**
     * One row per member with a boolean column {@code {name}_{d}_days} per delta, true when {@code condition} occurs between
     * zero and {@code d} days after an event of this cohort's predicate.
     */
    public Table hasOnset(String name, Predicate condition, List<Integer> timeDeltas) {
        Table occurrences = occurs(condition, TemporalSelector.after(predicate));
        List<String> columns = new ArrayList<>();
        columns.add(MEDICAL_RECORD_NUMBER);
        List<Set<String>> onsets = new ArrayList<>();
        for (Integer delta : timeDeltas) {
            columns.add(name + "_" + delta + "_days");
            onsets.add(occurrences.rows().stream()
                .filter(row -> row.getInteger(TIME_DELTA_IN_DAYS) != null && row.getInteger(TIME_DELTA_IN_DAYS) <= delta)
                .map(row -> row.getString(MEDICAL_RECORD_NUMBER))
                .collect(Collectors.toSet()));
        }
        Table.Builder result = Table.builder(columns);
        for (String subject : identifiers()) {
            List<Object> values = new ArrayList<>();
            values.add(subject);
            onsets.forEach(subjects -> values.add(subjects.contains(subject)));
            result.addRow(values);
        }
        return result.build();
    }

    public Table hasPrecondition(Predicate condition) {
        return hasPrecondition(condition, condition.label());
    }

    /**
     * One row per member with a boolean column {@code label}, true when {@code condition} occurs at or before an event of this
     * cohort's predicate.
     */
    public Table hasPrecondition(Predicate condition, String label) {
        Set<String> subjects = occurs(condition, TemporalSelector.before(predicate)).rows().stream()
            .filter(row -> row.get(TIME_DELTA_IN_DAYS) != null)
            .map(row -> row.getString(MEDICAL_RECORD_NUMBER))
            .collect(Collectors.toSet());
        Table.Builder result = Table.builder(MEDICAL_RECORD_NUMBER, label);
        identifiers().forEach(subject -> result.addRow(subject, subjects.contains(subject)));
        return result.build();
    }

    /**
     * Members joined with their patient record and every given table on {@code medical_record_number}. Only subjects present in
     * all tables remain. Clashing columns of the n-th table are prefixed with {@code data{n}_}.
     */
    public Table buildData(Table... tables) {
        Table.Builder base = Table.builder(MEDICAL_RECORD_NUMBER);
        identifiers().forEach(subject -> base.addRow(subject));
        Table merged = base.build().join(get(Criteria.patient()), List.of(MEDICAL_RECORD_NUMBER), JoinType.INNER, "patient_");
        for (int i = 0; i < tables.length; i++) {
            merged = merged.join(tables[i], List.of(MEDICAL_RECORD_NUMBER), JoinType.INNER, "data" + (i + 1) + "_");
        }
        return merged;
    }

    public Demographics demographics() {
        Table events = get(predicate);
        Map<String, List<Object>> agesBySubject = new LinkedHashMap<>();
        if (events.hasColumn(AGE_IN_DAYS)) {
            for (Table.Row row : events.rows()) {
                Integer age = row.getInteger(AGE_IN_DAYS);
                if (age != null && age < MAXIMUM_AGE_IN_DAYS) {
                    agesBySubject.computeIfAbsent(row.getString(MEDICAL_RECORD_NUMBER), s -> new ArrayList<>()).add(age);
                }
            }
        }
        double[] ages = agesBySubject.values().stream()
            .mapToDouble(subjectAges -> (Double) AggregationFunction.MEAN.apply(subjectAges) / 365)
            .toArray();
        double mean = ages.length == 0 ? Double.NaN : Arrays.stream(ages).average().orElseThrow();
        double std = Double.NaN;
        if (ages.length > 1) {
            double squares = Arrays.stream(ages).map(age -> (age - mean) * (age - mean)).sum();
            std = Math.sqrt(squares / (ages.length - 1));
        }

        Table genders = get(Criteria.patient().withColumns("D_PERSON.MEDICAL_RECORD_NUMBER", "D_PERSON.GENDER"));
        Map<String, Long> counts = genders.rows().stream()
            .map(row -> row.getString(GENDER))
            .filter(Objects::nonNull)
            .collect(Collectors.groupingBy(gender -> gender.toLowerCase(Locale.ROOT), TreeMap::new, Collectors.counting()));
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Map<String, Double> distribution = new TreeMap<>();
        counts.forEach((gender, count) -> distribution.put(gender, (double) count / total));
        return new Demographics(mean, std, distribution);
    }

    private static Table trimCodes(Table table, UnaryOperator<String> trimCode) {
        Table trimmed = table;
        for (String column : table.getColumns()) {
            if (column.contains("_code")) {
                trimmed = trimmed.withColumn(column, row -> {
                    String code = row.getString(column);
                    return code == null ? null : trimCode.apply(code);
                });
            }
        }
        return trimmed.distinct();
    }

    @Override
    public String toString() {
        return "Cohort[" + predicate.label() + (limit == null ? "" : ", limit " + limit) + "]";
    }
}
