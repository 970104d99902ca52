package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.query.ClauseMerger;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Criteria;
import edu.harvard.hms.dbmi.avillach.cohort.data.query.Criterion;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Join;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.JoinType;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.QueryDescription;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryPlannerTest {

    private final QueryPlanner queryPlanner = new QueryPlanner();

    @Test
    public void identifierQuery_diagnosis_shouldJoinPersonAndBridge() {
        QueryDescription query = queryPlanner.identifierQuery(Criteria.diagnosis("584.9", "ICD-9"));

        assertEquals(Relation.FACT, query.baseRelation());
        assertEquals(
            List.of(Relation.D_PERSON, Relation.B_DIAGNOSIS, Relation.FD_DIAGNOSIS), query.joins().stream().map(Join::relation).toList()
        );
        assertTrue(query.joins().stream().allMatch(join -> join.type() == JoinType.INNER));
        assertEquals(List.of(Relation.D_PERSON.column("MEDICAL_RECORD_NUMBER")), query.projection());
        assertTrue(query.distinct());
    }

    @Test
    public void identifierQuery_labValue_shouldNotJoinPerson() {
        QueryDescription query = queryPlanner.identifierQuery(Criteria.labValue("Creatinine"));

        assertEquals(Relation.EPIC_LAB, query.baseRelation());
        assertTrue(query.joins().isEmpty());
        assertEquals(Relation.EPIC_LAB.column("MEDICAL_RECORD_NUMBER"), query.identifierColumn());
    }

    @Test
    public void dataQuery_mergedCriterion_shouldLeftJoinDimensionsOfOneBranch() {
        Criterion diagnosis = Criteria.diagnosis("584.9", "ICD-9");
        Criterion measurement = Criteria.measurement("Creatinine");

        QueryDescription query = queryPlanner.dataQuery(ClauseMerger.merge(diagnosis, measurement));

        assertEquals(JoinType.INNER, query.joins().get(0).type());
        assertTrue(query.joins().subList(1, query.joins().size()).stream().allMatch(join -> join.type() == JoinType.LEFT));
        assertTrue(query.projection().containsAll(diagnosis.projectionColumns()));
        assertTrue(query.projection().containsAll(measurement.projectionColumns()));
    }

    @Test
    public void dataQuery_sameDimensions_shouldStayInnerJoins() {
        QueryDescription query = queryPlanner.dataQuery(
            ClauseMerger.merge(Criteria.diagnosis("584.9", "ICD-9"), Criteria.diagnosis("N17", "ICD-10"))
        );

        assertTrue(query.joins().stream().allMatch(join -> join.type() == JoinType.INNER));
    }
}
