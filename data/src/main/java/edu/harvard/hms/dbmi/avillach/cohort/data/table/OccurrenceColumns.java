package edu.harvard.hms.dbmi.avillach.cohort.data.table;

import java.util.*;

public final class OccurrenceColumns {

    public static final String MEDICAL_RECORD_NUMBER = "medical_record_number";

    public static final String AGE_IN_DAYS = "age_in_days";

    public static final String TIME_DELTA_IN_DAYS = "time_delta_in_days";

    /**
     * Identifies one occurrence of a condition in a table.
     */
    public static final List<String> INDEX = List.of(MEDICAL_RECORD_NUMBER, AGE_IN_DAYS);

    private OccurrenceColumns() {
    }

    public static void requireIndex(Table table) {
        for (String column : INDEX) {
            if (!table.hasColumn(column)) {
                throw new IllegalArgumentException("Table columns must include " + INDEX + " but were " + table.getColumns());
            }
        }
    }

    public static Table toTable(Collection<Occurrence> occurrences) {
        Table.Builder builder = Table.builder(INDEX);
        occurrences.stream().sorted(Comparator.comparing(Occurrence::subjectId).thenComparing(Occurrence::ageInDays,
            Comparator.nullsFirst(Comparator.naturalOrder()))).forEach(occurrence -> builder.addRow(occurrence.subjectId(), occurrence.ageInDays()));
        return builder.build().distinct();
    }
}
