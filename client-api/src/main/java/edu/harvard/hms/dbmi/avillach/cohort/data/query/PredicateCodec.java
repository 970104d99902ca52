package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Occurrence;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.exception.MalformedSerializationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts predicates to and from their dictionary form and its JSON rendering. Leaves are
 * {@code {"class": name, "attributes": {...}}} with optional {@code age_in_days}, {@code comparison} and {@code data_columns}
 * entries, composites are {@code {"and"|"or": [left, right]}}.
 */
public final class PredicateCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final ObjectMapper canonicalMapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private PredicateCodec() {
    }

    public static Map<String, Object> toDict(Predicate predicate) {
        return predicate.toDict();
    }

    public static String toJson(Predicate predicate) {
        try {
            return objectMapper.writeValueAsString(predicate.toDict());
        } catch (JsonProcessingException e) {
            throw new MalformedSerializationException("Could not serialize " + predicate.label(), e);
        }
    }

    public static Predicate fromJson(String json) {
        try {
            return fromDict(objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            throw new MalformedSerializationException("Not a valid cohort definition: " + json, e);
        }
    }

    /**
     * Rendering with map keys sorted, used for structural keys.
     */
    static String canonicalJson(Map<String, Object> dict) {
        try {
            return canonicalMapper.writeValueAsString(dict);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render " + dict, e);
        }
    }

    public static Predicate fromDict(Map<String, ?> dict) {
        if (dict == null) {
            throw new MalformedSerializationException("Missing cohort definition");
        }
        if (dict.containsKey("class")) {
            return leafFromDict(dict);
        }
        for (Operator operator : Operator.values()) {
            if (dict.containsKey(operator.key())) {
                return compositeFromDict(operator, dict.get(operator.key()));
            }
        }
        throw new MalformedSerializationException("Expected one of class, and, or in " + dict);
    }

    private static Predicate compositeFromDict(Operator operator, Object children) {
        if (!(children instanceof List<?> list) || list.isEmpty()) {
            throw new MalformedSerializationException("Expected a list of predicates under " + operator.key() + " but got " + children);
        }
        Predicate combined = null;
        for (Object child : list) {
            Predicate predicate = fromDict(asMap(child, operator.key()));
            combined = combined == null ? predicate : Predicates.combine(combined, predicate, operator);
        }
        return combined;
    }

    private static Predicate leafFromDict(Map<String, ?> dict) {
        Object className = dict.get("class");
        Map<String, ?> attributes = asMap(dict.get("attributes"), "attributes");
        if (IdentifierListPredicate.CLASS_NAME.equals(className)) {
            return identifiersFromAttributes(attributes);
        }
        CriterionKind kind = CriterionKind.fromClassName(String.valueOf(className))
            .orElseThrow(() -> new MalformedSerializationException("Unknown predicate class " + className));

        Criterion criterion;
        try {
            criterion = new Criterion(kind, kind.readParameters(attributes));
        } catch (IllegalArgumentException e) {
            throw new MalformedSerializationException("Invalid attributes for " + className + ": " + e.getMessage(), e);
        }

        if (dict.containsKey("age_in_days")) {
            for (Object age : asList(dict.get("age_in_days"), "age_in_days")) {
                Map<String, ?> range = asMap(age, "age_in_days");
                criterion = criterion.ageInDays(Attributes.integer(range, "min_days"), Attributes.integer(range, "max_days"));
            }
        }
        if (dict.containsKey("comparison")) {
            Map<String, ?> comparison = asMap(dict.get("comparison"), "comparison");
            String operator = Attributes.text(comparison, "operator");
            if (operator == null) {
                throw new MalformedSerializationException("Comparison without operator in " + dict);
            }
            try {
                criterion = criterion.compare(ComparisonOperator.fromKey(operator), Attributes.decimal(comparison, "value"));
            } catch (IllegalArgumentException e) {
                throw new MalformedSerializationException("Unknown comparison operator " + operator, e);
            }
        }
        if (dict.containsKey("data_columns")) {
            List<ColumnRef> columns = new ArrayList<>();
            for (Object column : asList(dict.get("data_columns"), "data_columns")) {
                try {
                    columns.add(ColumnRef.parse(String.valueOf(column)));
                } catch (IllegalArgumentException e) {
                    throw new MalformedSerializationException("Unknown column " + column, e);
                }
            }
            criterion = criterion.withColumns(columns);
        }
        return criterion;
    }

    private static IdentifierListPredicate identifiersFromAttributes(Map<String, ?> attributes) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (Object entry : asList(attributes.get("data"), "data")) {
            if (entry instanceof Map<?, ?>) {
                Map<String, ?> occurrence = asMap(entry, "data");
                Object subject = occurrence.get(OccurrenceColumns.MEDICAL_RECORD_NUMBER);
                if (subject == null) {
                    throw new MalformedSerializationException("Occurrence without subject: " + entry);
                }
                occurrences.add(new Occurrence(subject.toString(), Attributes.integer(occurrence, OccurrenceColumns.AGE_IN_DAYS)));
            } else if (entry != null) {
                occurrences.add(Occurrence.of(entry.toString()));
            }
        }
        return new IdentifierListPredicate(occurrences);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(Object value, String key) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, ?>) value;
        }
        throw new MalformedSerializationException("Expected an object for " + key + " but got " + value);
    }

    private static List<?> asList(Object value, String key) {
        if (value instanceof List<?> list) {
            return list;
        }
        throw new MalformedSerializationException("Expected a list for " + key + " but got " + value);
    }
}
