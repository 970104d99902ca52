package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Occurrence;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Subjects known up front, optionally with the ages at which they qualified.
 */
public final class IdentifierListPredicate implements Predicate {

    public static final String CLASS_NAME = "MRNs";

    private final List<Occurrence> occurrences;

    private final Set<String> identifiers;

    private final String label;

    private volatile String structuralKey;

    public IdentifierListPredicate(Collection<Occurrence> occurrences) {
        this(occurrences, null);
    }

    private IdentifierListPredicate(Collection<Occurrence> occurrences, String label) {
        this.label = label;
        this.occurrences = ImmutableList.copyOf(occurrences.stream().distinct().sorted(
            Comparator.comparing(Occurrence::subjectId).thenComparing(Occurrence::ageInDays, Comparator.nullsFirst(Comparator.naturalOrder()))
        ).collect(Collectors.toList()));
        this.identifiers = ImmutableSortedSet.copyOf(this.occurrences.stream().map(Occurrence::subjectId).collect(Collectors.toSet()));
    }

    public static IdentifierListPredicate ofIdentifiers(Collection<?> identifiers) {
        return new IdentifierListPredicate(identifiers.stream().map(id -> Occurrence.of(id.toString())).collect(Collectors.toList()));
    }

    public List<Occurrence> getOccurrences() {
        return occurrences;
    }

    @Override
    public Set<String> identifierCache() {
        return identifiers;
    }

    public Table toTable() {
        return OccurrenceColumns.toTable(occurrences);
    }

    @Override
    public Map<String, Object> toDict() {
        List<Map<String, Object>> data = new ArrayList<>();
        for (Occurrence occurrence : occurrences) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(OccurrenceColumns.MEDICAL_RECORD_NUMBER, occurrence.subjectId());
            entry.put(OccurrenceColumns.AGE_IN_DAYS, occurrence.ageInDays());
            data.add(entry);
        }
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("class", CLASS_NAME);
        dict.put("attributes", Map.of("data", data));
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
    public IdentifierListPredicate withLabel(String label) {
        return new IdentifierListPredicate(occurrences, label);
    }

    @Override
    public String label() {
        if (label != null) {
            return label;
        }
        return CLASS_NAME + " (" + identifiers.size() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierListPredicate)) return false;
        return occurrences.equals(((IdentifierListPredicate) o).occurrences);
    }

    @Override
    public int hashCode() {
        return occurrences.hashCode();
    }

    @Override
    public String toString() {
        return label();
    }
}
