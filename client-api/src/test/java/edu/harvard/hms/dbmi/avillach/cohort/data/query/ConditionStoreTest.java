package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.exception.MalformedSerializationException;
import edu.harvard.hms.dbmi.avillach.cohort.exception.NotImplementedBehaviorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConditionStoreTest {

    private ConditionStore conditionStore;

    @BeforeEach
    public void setup() {
        conditionStore = ConditionStore.fromClasspath();
    }

    @Test
    public void availableConditions_shouldListNamesInFileOrder() {
        assertEquals(List.of("acute kidney failure", "diabetes"), conditionStore.availableConditions(CriterionKind.DIAGNOSIS));
        assertEquals(List.of(), conditionStore.availableConditions(CriterionKind.PROCEDURE));
    }

    @Test
    public void condition_severalSchemes_shouldFoldCodesIntoOneMergedCriterion() {
        Predicate condition = conditionStore.condition(CriterionKind.DIAGNOSIS, "acute kidney failure", List.of("ICD-9", "ICD-10"));

        Predicate expected = Criteria.diagnosis("584.9", "ICD-9")
            .or(Criteria.diagnosis("N17", "ICD-10"))
            .or(Criteria.diagnosis("N17.9", "ICD-10"));
        assertThat(condition, instanceOf(MergedCriterion.class));
        assertEquals(expected.structuralKey(), condition.structuralKey());
        assertEquals("acute kidney failure", condition.label());
    }

    @Test
    public void condition_singleCode_shouldKeepLabel() {
        Predicate condition = conditionStore.condition(CriterionKind.DRUG, "metformin", List.of("RxNorm"));

        assertThat(condition, instanceOf(Criterion.class));
        assertEquals("metformin", condition.label());
        assertEquals(new DrugParameters(null, "6809", "RxNorm"), ((Criterion) condition).getParameters());
    }

    @Test
    public void condition_schemeSubset_shouldOnlyUseThoseCodes() {
        Predicate condition = conditionStore.condition(CriterionKind.DIAGNOSIS, "acute kidney failure", List.of("ICD-9"));

        assertEquals(Criteria.diagnosis("584.9", "ICD-9").structuralKey(), condition.structuralKey());
    }

    @Test
    public void condition_unknownName_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> conditionStore.condition(CriterionKind.DIAGNOSIS, "sepsis", List.of("ICD-10")));
    }

    @Test
    public void condition_schemeWithoutCodes_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> conditionStore.condition(CriterionKind.DIAGNOSIS, "diabetes", List.of("ICD-9")));
        assertThrows(IllegalArgumentException.class,
            () -> conditionStore.condition(CriterionKind.DIAGNOSIS, "diabetes", List.of()));
    }

    @Test
    public void condition_kindWithoutCodes_shouldThrowNotImplemented() {
        assertThrows(NotImplementedBehaviorException.class,
            () -> conditionStore.condition(CriterionKind.PATIENT, "diabetes", List.of("ICD-10")));
    }

    @Test
    public void fromYaml_notAList_shouldThrowMalformed() {
        ByteArrayInputStream yaml = new ByteArrayInputStream("Diagnosis: 584.9\n".getBytes(StandardCharsets.UTF_8));
        assertThrows(MalformedSerializationException.class, () -> ConditionStore.fromYaml(yaml));
    }

    @Test
    public void fromClasspath_missingResource_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> ConditionStore.fromClasspath("no-such-conditions.yml"));
    }

    @Test
    public void withLabel_shouldNotChangeStructuralKey() {
        Criterion diagnosis = Criteria.diagnosis("E11.9", "ICD-10");
        Predicate labelled = diagnosis.withLabel("diabetes");

        assertEquals(diagnosis, labelled);
        assertEquals(diagnosis.structuralKey(), labelled.structuralKey());
        assertEquals("diabetes", labelled.label());
        assertEquals("diabetes", Criteria.identifiers(List.of("A")).withLabel("diabetes").label());
        assertEquals("diabetes", diagnosis.and(Criteria.patient()).withLabel("diabetes").label());
    }
}
