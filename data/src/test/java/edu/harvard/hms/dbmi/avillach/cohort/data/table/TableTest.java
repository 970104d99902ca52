package edu.harvard.hms.dbmi.avillach.cohort.data.table;

import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.JoinType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

public class TableTest {

    private final Table events = Table.builder("MEDICAL_RECORD_NUMBER", "age_in_days", "description")
        .addRow("A", 100, "Creatinine")
        .addRow("A", 100, "Creatinine")
        .addRow("B", 200, "Sodium")
        .addRow("C", 300, null)
        .build();

    @Test
    public void constructor_mixedCaseColumns_shouldLowerCase() {
        assertEquals(List.of("medical_record_number", "age_in_days", "description"), events.getColumns());
        assertTrue(events.hasColumn("medical_record_number"));
    }

    @Test
    public void constructor_duplicateColumns_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Table.builder("code", "CODE").build());
    }

    @Test
    public void addRow_wrongWidth_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Table.builder("a", "b").addRow("only one").build());
    }

    @Test
    public void indexOf_unknownColumn_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> events.indexOf("numeric_value"));
    }

    @Test
    public void distinct_duplicateRows_shouldKeepFirst() {
        Table distinct = events.distinct();
        assertEquals(3, distinct.size());
        assertEquals("A", distinct.row(0).get("medical_record_number"));
    }

    @Test
    public void select_subsetOfColumns_shouldKeepOrderGiven() {
        Table selected = events.select("description", "medical_record_number");
        assertEquals(List.of("description", "medical_record_number"), selected.getColumns());
        assertEquals("Creatinine", selected.row(0).get("description"));
    }

    @Test
    public void filter_nullCells_shouldBeVisibleToPredicate() {
        Table missing = events.filter(row -> row.get("description") == null);
        assertEquals(1, missing.size());
        assertEquals("C", missing.row(0).getString("medical_record_number"));
    }

    @Test
    public void withColumn_existingColumn_shouldReplaceInPlace() {
        Table upper = events.withColumn("description", row -> row.getString("description") == null ? null : "x");
        assertEquals(events.getColumns(), upper.getColumns());
        assertEquals("x", upper.row(0).get("description"));
    }

    @Test
    public void rename_shouldOnlyTouchNamedColumns() {
        Table renamed = events.rename(Map.of("description", "test_name"));
        assertEquals(List.of("medical_record_number", "age_in_days", "test_name"), renamed.getColumns());
    }

    @Test
    public void join_leftJoin_shouldKeepUnmatchedRows() {
        Table genders = Table.builder("medical_record_number", "gender").addRow("A", "Female").addRow("B", "Male").build();

        Table joined = events.distinct().join(genders, List.of("medical_record_number"), JoinType.LEFT, "right_");

        assertEquals(List.of("medical_record_number", "age_in_days", "description", "gender"), joined.getColumns());
        assertEquals(3, joined.size());
        assertNull(joined.row(2).get("gender"));
    }

    @Test
    public void join_innerJoin_shouldDropUnmatchedAndPrefixClashes() {
        Table other = Table.builder("medical_record_number", "description").addRow("B", "Potassium").build();

        Table joined = events.join(other, List.of("medical_record_number"), JoinType.INNER, "right_");

        assertThat(joined.getColumns(), contains("medical_record_number", "age_in_days", "description", "right_description"));
        assertEquals(1, joined.size());
        assertEquals(Arrays.asList("B", 200, "Sodium", "Potassium"), joined.row(0).values());
    }

    @Test
    public void join_nullKeys_shouldNeverMatch() {
        Table left = Table.builder("k", "v").addRow(null, 1).build();
        Table right = Table.builder("k", "w").addRow(null, 2).build();

        assertTrue(left.join(right, List.of("k"), JoinType.INNER, "r_").isEmpty());
    }

    @Test
    public void rowAccessors_numericConversions() {
        Table numbers = Table.builder("age_in_days", "numeric_value").addRow(100L, "1.5").build();
        assertEquals(100, numbers.row(0).getInteger("age_in_days"));
        assertEquals(1.5, numbers.row(0).getDouble("numeric_value"));
    }

    @Test
    public void toTable_occurrences_shouldBeSortedAndDistinct() {
        Table table = OccurrenceColumns.toTable(List.of(new Occurrence("B", 10), new Occurrence("A", 5), new Occurrence("B", 10)));
        assertEquals(OccurrenceColumns.INDEX, table.getColumns());
        assertEquals(List.of("A", "B"), table.column("medical_record_number"));
    }

    @Test
    public void requireIndex_missingAge_shouldThrow() {
        Table table = Table.builder("medical_record_number").addRow("A").build();
        assertThrows(IllegalArgumentException.class, () -> OccurrenceColumns.requireIndex(table));
    }

    @Test
    public void equals_sameContent_shouldBeEqual() {
        Table copy = Table.builder("medical_record_number", "age_in_days", "description")
            .addRow("A", 100, "Creatinine").addRow("A", 100, "Creatinine").addRow("B", 200, "Sodium").addRow("C", 300, null)
            .build();
        assertEquals(events, copy);
        assertEquals(events.hashCode(), copy.hashCode());
    }
}
