package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Dimension;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import edu.harvard.hms.dbmi.avillach.cohort.exception.IncompatibleCombinationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

public class ClauseMergerTest {

    private final Criterion icd9 = Criteria.diagnosis("584.9", "ICD-9");

    private final Criterion icd10 = Criteria.diagnosis("N17", "ICD-10");

    @Test
    public void merge_sameRelation_shouldOrFilters() {
        MergedCriterion merged = ClauseMerger.merge(icd9, icd10);

        assertEquals(Relation.FACT, merged.baseRelation());
        assertEquals(FilterExpression.or(icd9.filter(), icd10.filter()), merged.filter());
        assertEquals(icd9.projectionColumns(), merged.projectionColumns());
    }

    @Test
    public void merge_differentDimensions_shouldOnlyRequireSharedOnes() {
        MergedCriterion merged = ClauseMerger.merge(icd9, Criteria.measurement("Creatinine"));

        assertEquals(Set.of(Dimension.DIAGNOSIS, Dimension.PROCEDURE, Dimension.UNIT_OF_MEASURE), merged.joinedDimensions());
        assertEquals(Set.of(), merged.requiredDimensions());
    }

    @Test
    public void merge_projection_shouldBeOrderedUnion() {
        Criterion left = icd9.withColumns("D_PERSON.MEDICAL_RECORD_NUMBER", "FACT.AGE_IN_DAYS");
        Criterion right = icd10.withColumns("FACT.AGE_IN_DAYS", "FD_DIAGNOSIS.DESCRIPTION");

        assertEquals(
            List.of(
                Relation.D_PERSON.column("MEDICAL_RECORD_NUMBER"), Relation.FACT.column("AGE_IN_DAYS"),
                Relation.FD_DIAGNOSIS.column("DESCRIPTION")
            ),
            ClauseMerger.merge(left, right).projectionColumns()
        );
    }

    @Test
    public void merge_differentRelations_shouldThrow() {
        assertFalse(ClauseMerger.canMerge(icd9, Criteria.labValue("Creatinine")));
        assertThrows(IncompatibleCombinationException.class, () -> ClauseMerger.merge(icd9, Criteria.labValue("Creatinine")));
    }

    @Test
    public void or_sameRelation_shouldMergeWhileAndShouldNot() {
        assertThat(icd9.or(icd10), instanceOf(MergedCriterion.class));
        assertThat(icd9.and(icd10), instanceOf(CompositePredicate.class));
        assertThat(icd9.or(Criteria.identifiers(List.of("A"))), instanceOf(CompositePredicate.class));
    }

    @Test
    public void leaves_nestedComposite_shouldFlattenInOrder() {
        Criterion lab = Criteria.labValue("Creatinine");
        CompositePredicate composite = new CompositePredicate(Operator.AND, new CompositePredicate(Operator.OR, icd9, lab), icd10);

        assertEquals(List.of(icd9, lab, icd10), composite.leaves());
    }

    @Test
    public void mergeAll_empty_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> ClauseMerger.mergeAll(List.of()));
    }
}
