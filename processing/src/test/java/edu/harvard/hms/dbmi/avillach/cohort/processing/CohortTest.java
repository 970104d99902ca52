package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.ConditionStore;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Criteria;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Criterion;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.CriterionKind;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.FactParameters;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Predicate;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.InMemoryWarehouseClient;
import edu.harvard.hms.dbmi.avillach.cohort.processing.temporal.TemporalJoinService;
import edu.harvard.hms.dbmi.avillach.cohort.processing.temporal.TemporalSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

public class CohortTest {

    private InMemoryWarehouseClient warehouse;

    private CohortFactory cohortFactory;

    private final Criterion acuteKidneyFailure = Criteria.diagnosis("584.9", "ICD-9");

    private final Criterion creatinine = Criteria.measurement("Creatinine");

    private Cohort cohort;

    @BeforeEach
    public void setup() {
        warehouse = Warehouses.clinical();
        ConditionEngine conditionEngine = new ConditionEngine(warehouse, new QueryPlanner(), new ResolutionCache(-1, -1));
        cohortFactory = new CohortFactory(conditionEngine, new TemporalJoinService());
        cohort = cohortFactory.create(acuteKidneyFailure);
    }

    @Test
    public void identifiers_shouldResolveOnceAndApplyExclusions() {
        assertEquals(Set.of("A", "B"), cohort.identifiers());
        int queries = warehouse.getQueryCount();

        cohort.exclude(List.of("A"));

        assertEquals(Set.of("B"), cohort.identifiers());
        assertEquals(1, cohort.size());
        assertEquals(Set.of("A"), cohort.getExcluded());
        assertEquals(queries, warehouse.getQueryCount());
    }

    @Test
    public void identifiers_shouldBeSorted() {
        Cohort everyone = cohortFactory.create(acuteKidneyFailure.or(Criteria.diagnosis("E11.9", "ICD-10")));

        assertEquals(List.of("A", "B", "D"), List.copyOf(everyone.identifiers()));
    }

    @Test
    public void exclude_numericIdentifiers_shouldCompareByString() {
        Cohort numbered = cohortFactory.create(Criteria.identifiers(List.of(1, 2, 3)));

        numbered.exclude(Set.of(2));

        assertEquals(Set.of("1", "3"), numbered.identifiers());
    }

    @Test
    public void create_negativeLimit_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> cohortFactory.create(acuteKidneyFailure, -1));
        assertThrows(IllegalArgumentException.class, () -> cohortFactory.create(null));
    }

    @Test
    public void getAll_sameBaseRelation_shouldReturnOneTablePerRelation() {
        List<Table> tables = cohort.getAll(Criteria.diagnosis("E11.9", "ICD-10"), creatinine, Criteria.diagnosis("N17", "ICD-10"));

        assertEquals(2, tables.size());
        assertEquals(Set.of("E11.9", "N17"), new HashSet<>(tables.get(0).column("context_diagnosis_code")));
        assertEquals(3, tables.get(1).size());
    }

    @Test
    public void getAll_diagnosisAndProcedure_shouldFetchOneTable() {
        List<Table> tables = cohort.getAll(Criteria.diagnosis("N17", "ICD-10"), Criteria.procedure(FactParameters.ofDescription("Creatinine")));

        assertEquals(1, tables.size());
        Table data = tables.get(0);
        assertEquals(3, data.size());
        assertEquals(Set.of("ICD-10", "LOINC"), new HashSet<>(data.column("context_name")));
        assertEquals(Set.of("A", "B"), new HashSet<>(data.column("medical_record_number")));
    }

    @Test
    public void occurs_mergedTarget_shouldJoinSharedContextColumn() {
        Table occurrences = cohort.occurs(creatinine.or(Criteria.diagnosis("E11.9", "ICD-10")), TemporalSelector.relativeTo(acuteKidneyFailure));

        assertThat(occurrences.getColumns(), hasItems("context_name", "target_context_name", "time_delta_in_days"));
        assertEquals(Set.of(-10, 5), new HashSet<>(occurrences.column("time_delta_in_days")));
    }

    @Test
    public void occurs_after_shouldKeepTargetsOnOrAfterAnchor() {
        Table occurrences = cohort.occurs(creatinine, TemporalSelector.after(acuteKidneyFailure));

        assertEquals(2, occurrences.size());
        for (Table.Row row : occurrences.rows()) {
            assertEquals("A", row.get("medical_record_number"));
            assertEquals(5, row.get("time_delta_in_days"));
            assertEquals("584", row.get("context_diagnosis_code"));
            assertEquals("LOINC", row.get("target_context_name"));
        }
    }

    @Test
    public void occurs_before_shouldKeepTargetsOnOrBeforeAnchor() {
        Table occurrences = cohort.occurs(creatinine, TemporalSelector.before(acuteKidneyFailure));

        assertEquals(1, occurrences.size());
        assertEquals("B", occurrences.row(0).get("medical_record_number"));
        assertEquals(-10, occurrences.row(0).get("time_delta_in_days"));
    }

    @Test
    public void occurs_customTrim_shouldApplyToCodes() {
        Table occurrences = cohort.occurs(creatinine, TemporalSelector.after(acuteKidneyFailure), code -> code);

        assertEquals("584.9", occurrences.row(0).get("context_diagnosis_code"));
    }

    @Test
    public void hasOnset_shouldFlagEachDelta() {
        Table onset = cohort.hasOnset("creatinine", creatinine);

        assertEquals(
            List.of("medical_record_number", "creatinine_1_days", "creatinine_7_days", "creatinine_14_days", "creatinine_28_days"),
            onset.getColumns()
        );
        assertEquals(List.of("A", false, true, true, true), onset.row(0).values());
        assertEquals(List.of("B", false, false, false, false), onset.row(1).values());
    }

    @Test
    public void hasPrecondition_shouldFlagEarlierOccurrence() {
        Table precondition = cohort.hasPrecondition(Criteria.diagnosis("E11.9", "ICD-10"), "diabetes");

        assertEquals(List.of("medical_record_number", "diabetes"), precondition.getColumns());
        assertEquals(List.of("A", true), precondition.row(0).values());
        assertEquals(List.of("B", false), precondition.row(1).values());
    }

    @Test
    public void hasPrecondition_storedCondition_shouldUseItsName() {
        ConditionStore conditionStore = new ConditionStore(Map.of(
            "Diagnosis", List.of(Map.<String, Object>of("name", "diabetes", "ICD-10", List.of("E11.9", "E11.65")))
        ));
        Predicate diabetes = conditionStore.condition(CriterionKind.DIAGNOSIS, "diabetes", List.of("ICD-10"));

        Table precondition = cohort.hasPrecondition(diabetes);

        assertEquals(List.of("medical_record_number", "diabetes"), precondition.getColumns());
        assertEquals(List.of("A", true), precondition.row(0).values());
        assertEquals(List.of("B", false), precondition.row(1).values());
    }

    @Test
    public void valuesFor_shouldAverageValuesPerOccurrence() {
        Table values = cohort.valuesFor(creatinine, TemporalSelector.after(acuteKidneyFailure));

        assertEquals(List.of("medical_record_number", "age_in_days", "numeric_value", "time_delta_in_days"), values.getColumns());
        assertEquals(1, values.size());
        assertEquals("A", values.row(0).get("medical_record_number"));
        assertEquals(100, values.row(0).get("age_in_days"));
        assertEquals(1.2, values.row(0).getDouble("numeric_value"), 1e-9);
        assertEquals(5, values.row(0).get("time_delta_in_days"));
    }

    @Test
    public void demographics_shouldSummariseAgeAndGender() {
        Demographics demographics = cohort.demographics();

        assertEquals(150.0 / 365, demographics.meanAgeYears(), 1e-9);
        assertEquals(Math.sqrt(5000) / 365, demographics.stdAgeYears(), 1e-9);
        assertEquals(0.5, demographics.genderDistribution().get("female"), 1e-9);
        assertEquals(0.5, demographics.genderDistribution().get("male"), 1e-9);
    }

    @Test
    public void buildData_shouldJoinPatientRecordAndTables() {
        Table onset = cohort.hasOnset("creatinine", creatinine, List.of(7));

        Table data = cohort.buildData(onset);

        assertEquals(2, data.size());
        assertThat(data.getColumns(), hasItems("medical_record_number", "gender", "creatinine_7_days"));
    }

    @Test
    public void toString_shouldNameLimit() {
        assertThat(cohortFactory.create(acuteKidneyFailure, 10).toString(), containsString("limit 10"));
    }
}
