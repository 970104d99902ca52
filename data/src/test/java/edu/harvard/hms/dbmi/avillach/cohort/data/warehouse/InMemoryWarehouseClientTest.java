package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation.*;
import static org.junit.jupiter.api.Assertions.*;

public class InMemoryWarehouseClientTest {

    private InMemoryWarehouseClient warehouse;

    @BeforeEach
    public void setup() {
        warehouse = new InMemoryWarehouseClient()
            .insert(D_PERSON, Map.of("PERSON_KEY", 1, "MEDICAL_RECORD_NUMBER", "A", "GENDER", "Female", "ACTIVE_FLAG", "Y"))
            .insert(D_PERSON, Map.of("PERSON_KEY", 2, "MEDICAL_RECORD_NUMBER", "B", "GENDER", "Male", "ACTIVE_FLAG", "Y"))
            .insert(B_DIAGNOSIS, Map.of("DIAGNOSIS_GROUP_KEY", 10, "DIAGNOSIS_KEY", 100))
            .insert(FD_DIAGNOSIS, Map.of("DIAGNOSIS_KEY", 100, "CONTEXT_NAME", "ICD-9", "CONTEXT_DIAGNOSIS_CODE", "584.9"))
            .insert(FACT, Map.of("PERSON_KEY", 1, "AGE_IN_DAYS", 100, "DIAGNOSIS_GROUP_KEY", 10))
            .insert(FACT, Map.of("PERSON_KEY", 2, "AGE_IN_DAYS", 200, "DIAGNOSIS_GROUP_KEY", 10))
            .insert(FACT, Map.of("PERSON_KEY", 2, "AGE_IN_DAYS", 250, "NUMERIC_VALUE", 1.4));
    }

    private List<Join> diagnosisJoins(JoinType type) {
        List<Join> joins = new ArrayList<>();
        joins.add(new Join(D_PERSON, FACT.column("PERSON_KEY"), D_PERSON.column("PERSON_KEY"), JoinType.INNER));
        joins.addAll(Dimension.DIAGNOSIS.joins(type));
        return joins;
    }

    @Test
    public void resolveDataQuery_sharedOutputName_shouldFillOneColumn() {
        ColumnRef mrn = D_PERSON.column("MEDICAL_RECORD_NUMBER");
        List<Join> joins = diagnosisJoins(JoinType.LEFT);
        joins.addAll(Dimension.PROCEDURE.joins(JoinType.LEFT));
        QueryDescription query = new QueryDescription(
            FACT, joins, FilterExpression.always(),
            List.of(mrn, FACT.column("AGE_IN_DAYS"), FD_PROCEDURE.column("CONTEXT_NAME"), FD_DIAGNOSIS.column("CONTEXT_NAME")), mrn, true
        );

        Table table = warehouse.resolveDataQuery(query, null, null);

        assertEquals(List.of("medical_record_number", "age_in_days", "context_name"), query.outputColumns());
        assertEquals(query.outputColumns(), table.getColumns());
        assertEquals(3, table.size());
        for (Table.Row row : table.rows()) {
            assertEquals(row.getInteger("age_in_days") == 250 ? null : "ICD-9", row.get("context_name"));
        }
    }

    @Test
    public void insert_unknownColumn_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> warehouse.insert(D_PERSON, Map.of("SHOE_SIZE", 9)));
    }

    @Test
    public void resolveIdentifierQuery_likeFilter_shouldReturnMatchingSubjects() {
        ColumnRef mrn = D_PERSON.column("MEDICAL_RECORD_NUMBER");
        QueryDescription query = new QueryDescription(
            FACT, diagnosisJoins(JoinType.INNER), FilterExpression.like(FD_DIAGNOSIS.column("CONTEXT_DIAGNOSIS_CODE"), "584.%"),
            List.of(mrn), mrn, true
        );

        assertEquals(Set.of("A", "B"), warehouse.resolveIdentifierQuery(query, null));
        assertEquals(Set.of("A"), warehouse.resolveIdentifierQuery(query, 1));
        assertEquals(2, warehouse.getIdentifierQueryCount());
    }

    @Test
    public void resolveDataQuery_leftJoin_shouldKeepFactsWithoutDimension() {
        ColumnRef mrn = D_PERSON.column("MEDICAL_RECORD_NUMBER");
        QueryDescription query = new QueryDescription(
            FACT, diagnosisJoins(JoinType.LEFT), FilterExpression.always(),
            List.of(mrn, FACT.column("AGE_IN_DAYS"), FD_DIAGNOSIS.column("CONTEXT_DIAGNOSIS_CODE")), mrn, true
        );

        Table table = warehouse.resolveDataQuery(query, Set.of("B"), null);

        assertEquals(List.of("medical_record_number", "age_in_days", "context_diagnosis_code"), table.getColumns());
        assertEquals(2, table.size());
        assertEquals(1, warehouse.getDataQueryCount());
        assertEquals(List.of(query), warehouse.getExecutedQueries());
    }

    @Test
    public void resolveDataQuery_comparisonAgainstMissingValue_shouldNotMatch() {
        ColumnRef mrn = D_PERSON.column("MEDICAL_RECORD_NUMBER");
        QueryDescription query = new QueryDescription(
            FACT, diagnosisJoins(JoinType.LEFT), FilterExpression.compare(FACT.column("NUMERIC_VALUE"), ComparisonOperator.GT, 1),
            List.of(mrn, FACT.column("NUMERIC_VALUE")), mrn, true
        );

        Table table = warehouse.resolveDataQuery(query, null, null);

        assertEquals(1, table.size());
        assertEquals(1.4, table.row(0).getDouble("numeric_value"));
    }

    @Test
    public void resolveDataQuery_distinct_shouldCollapseRepeatedRows() {
        ColumnRef mrn = D_PERSON.column("MEDICAL_RECORD_NUMBER");
        QueryDescription query = new QueryDescription(
            FACT, diagnosisJoins(JoinType.LEFT), FilterExpression.always(), List.of(mrn), mrn, true
        );

        assertEquals(2, warehouse.resolveDataQuery(query, null, null).size());
    }
}
