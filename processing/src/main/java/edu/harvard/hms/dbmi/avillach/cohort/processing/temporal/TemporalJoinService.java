package edu.harvard.hms.dbmi.avillach.cohort.processing.temporal;

import edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

import static edu.harvard.hms.dbmi.avillach.cohort.data.table.OccurrenceColumns.*;

/**
 * Relates target events to anchor events of the same subject.
 */
@Component
public class TemporalJoinService {

    private static final Logger log = LoggerFactory.getLogger(TemporalJoinService.class);

    public static final String TARGET_PREFIX = "target_";

    /**
     * Joins every anchor row to the target rows of the same subject and adds {@code time_delta_in_days}, the target age minus the
     * anchor age. The target age column is dropped, other target columns named like an anchor column are prefixed with
     * {@code target_}. BEFORE keeps deltas up to zero, AFTER keeps deltas from zero, RELATIVE keeps everything, including anchor
     * rows without any target. An empty target gives an empty table with the full set of columns.
     */
    public Table joinOccurrences(Table anchor, Table target, TemporalRelation relation) {
        if (relation == null) {
            throw new IllegalArgumentException("A temporal relation is required");
        }
        OccurrenceColumns.requireIndex(anchor);
        OccurrenceColumns.requireIndex(target);

        List<String> columns = new ArrayList<>(anchor.getColumns());
        List<String> carried = new ArrayList<>();
        for (String column : target.getColumns()) {
            if (INDEX.contains(column)) {
                continue;
            }
            String name = anchor.hasColumn(column) || TIME_DELTA_IN_DAYS.equals(column) ? TARGET_PREFIX + column : column;
            if (columns.contains(name)) {
                throw new IllegalArgumentException("Column " + name + " is present in both anchor and target");
            }
            columns.add(name);
            carried.add(column);
        }
        columns.add(TIME_DELTA_IN_DAYS);

        if (target.isEmpty()) {
            return Table.empty(columns);
        }

        Map<String, List<Table.Row>> targetsBySubject = new HashMap<>();
        for (Table.Row row : target.rows()) {
            String subject = row.getString(MEDICAL_RECORD_NUMBER);
            if (subject != null) {
                targetsBySubject.computeIfAbsent(subject, s -> new ArrayList<>()).add(row);
            }
        }

        Table.Builder joined = Table.builder(columns);
        for (Table.Row row : anchor.rows()) {
            List<Table.Row> matches = targetsBySubject.getOrDefault(row.getString(MEDICAL_RECORD_NUMBER), List.of());
            if (matches.isEmpty() && relation.accepts(null)) {
                List<Object> values = new ArrayList<>(row.values());
                carried.forEach(column -> values.add(null));
                values.add(null);
                joined.addRow(values);
            }
            Integer anchorAge = row.getInteger(AGE_IN_DAYS);
            for (Table.Row match : matches) {
                Integer targetAge = match.getInteger(AGE_IN_DAYS);
                Integer delta = anchorAge == null || targetAge == null ? null : targetAge - anchorAge;
                if (relation.accepts(delta)) {
                    List<Object> values = new ArrayList<>(row.values());
                    carried.forEach(column -> values.add(match.get(column)));
                    values.add(delta);
                    joined.addRow(values);
                }
            }
        }
        Table result = joined.build();
        log.debug("Joined {} anchor rows and {} target rows {} into {} rows", anchor.size(), target.size(), relation, result.size());
        return result;
    }
}
