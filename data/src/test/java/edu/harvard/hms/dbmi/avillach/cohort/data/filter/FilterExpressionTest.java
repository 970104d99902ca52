package edu.harvard.hms.dbmi.avillach.cohort.data.filter;

import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FilterExpressionTest {

    private final FilterExpression code = FilterExpression.like(Relation.FD_DIAGNOSIS.column("CONTEXT_DIAGNOSIS_CODE"), "584.9");

    private final FilterExpression age = FilterExpression.compare(Relation.FACT.column("AGE_IN_DAYS"), ComparisonOperator.GE, 0);

    @Test
    public void and_alwaysOperands_shouldBeDropped() {
        assertEquals(code, FilterExpression.and(FilterExpression.always(), code));
        assertEquals(FilterExpression.always(), FilterExpression.and(List.of()));
    }

    @Test
    public void and_nestedConjunctions_shouldFlatten() {
        FilterExpression nested = FilterExpression.and(FilterExpression.and(code, age), code);
        assertEquals(new FilterExpression.And(List.of(code, age, code)), nested);
    }

    @Test
    public void or_alwaysOperand_shouldBeAlwaysTrue() {
        assertEquals(FilterExpression.always(), FilterExpression.or(code, FilterExpression.always()));
    }

    @Test
    public void or_noOperands_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> FilterExpression.or(List.of()));
    }

    @Test
    public void relations_shouldCollectEveryReadRelation() {
        assertEquals(Set.of(Relation.FD_DIAGNOSIS, Relation.FACT), FilterExpression.or(code, age).relations());
    }

    @Test
    public void accepts_shouldFollowOperator() {
        assertTrue(ComparisonOperator.GE.accepts(0));
        assertFalse(ComparisonOperator.GT.accepts(0));
        assertTrue(ComparisonOperator.NE.accepts(-1));
        assertEquals(ComparisonOperator.LE, ComparisonOperator.fromKey("le"));
    }

    @Test
    public void parse_qualifiedName_shouldRoundTrip() {
        ColumnRef column = ColumnRef.parse("FACT.AGE_IN_DAYS");
        assertEquals(Relation.FACT.column("AGE_IN_DAYS"), column);
        assertEquals("age_in_days", column.outputName());
        assertThrows(IllegalArgumentException.class, () -> ColumnRef.parse("AGE_IN_DAYS"));
    }
}
