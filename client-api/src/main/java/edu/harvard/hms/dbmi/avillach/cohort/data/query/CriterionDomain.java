package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;
import edu.harvard.hms.dbmi.avillach.cohort.data.filter.FilterExpression;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.ColumnRef;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Dimension;
import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation;
import edu.harvard.hms.dbmi.avillach.cohort.exception.NotImplementedBehaviorException;

import java.util.List;
import java.util.Set;

import static edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation.*;

/**
 * Where a family of criteria lives in the warehouse: the relation it filters, the dimensions it joins, the columns it returns by
 * default and the columns its attributes match against. A null column means the domain does not support that attribute.
 */
public enum CriterionDomain {

    PATIENT(
        D_PERSON, Set.of(),
        List.of(
            D_PERSON.column("MEDICAL_RECORD_NUMBER"), D_PERSON.column("DATE_OF_BIRTH"), D_PERSON.column("MONTH_OF_BIRTH"),
            D_PERSON.column("GENDER"), D_PERSON.column("RELIGION"), D_PERSON.column("RACE"), D_PERSON.column("PATIENT_ETHNIC_GROUP"),
            D_PERSON.column("DECEASED_INDICATOR"), D_PERSON.column("MOTHER_ACCOUNT_NUMBER"), D_PERSON.column("ADDRESS_ZIP"),
            D_PERSON.column("MARITAL_STATUS_CODE")
        ),
        null, null, null, null, null, null,
        FilterExpression.compare(D_PERSON.column("ACTIVE_FLAG"), ComparisonOperator.EQ, "Y")
    ),
    DIAGNOSIS(
        FACT, Set.of(Dimension.DIAGNOSIS), factColumns(FD_DIAGNOSIS.column("CONTEXT_NAME"), FD_DIAGNOSIS.column("CONTEXT_DIAGNOSIS_CODE")),
        FD_DIAGNOSIS.column("CONTEXT_NAME"), FD_DIAGNOSIS.column("CONTEXT_DIAGNOSIS_CODE"), FD_DIAGNOSIS.column("DIAGNOSIS_TYPE"),
        FD_DIAGNOSIS.column("DESCRIPTION"), FACT.column("AGE_IN_DAYS"), null, FilterExpression.always()
    ),
    PROCEDURE(
        FACT, Set.of(Dimension.PROCEDURE), factColumns(FD_PROCEDURE.column("CONTEXT_NAME"), FD_PROCEDURE.column("CONTEXT_PROCEDURE_CODE")),
        FD_PROCEDURE.column("CONTEXT_NAME"), FD_PROCEDURE.column("CONTEXT_PROCEDURE_CODE"), FD_PROCEDURE.column("PROCEDURE_TYPE"),
        FD_PROCEDURE.column("PROCEDURE_DESCRIPTION"), FACT.column("AGE_IN_DAYS"), null, FilterExpression.always()
    ),
    MEASUREMENT(
        FACT, Set.of(Dimension.PROCEDURE, Dimension.UNIT_OF_MEASURE),
        List.of(
            D_PERSON.column("MEDICAL_RECORD_NUMBER"), FACT.column("AGE_IN_DAYS"), FACT.column("TIME_OF_DAY_KEY"),
            FD_PROCEDURE.column("CONTEXT_NAME"), FD_PROCEDURE.column("CONTEXT_PROCEDURE_CODE"), FACT.column("NUMERIC_VALUE"),
            D_UNIT_OF_MEASURE.column("UNIT_OF_MEASURE")
        ),
        FD_PROCEDURE.column("CONTEXT_NAME"), FD_PROCEDURE.column("CONTEXT_PROCEDURE_CODE"), FD_PROCEDURE.column("PROCEDURE_TYPE"),
        FD_PROCEDURE.column("PROCEDURE_DESCRIPTION"), FACT.column("AGE_IN_DAYS"), FACT.column("NUMERIC_VALUE"), FilterExpression.always()
    ),
    MATERIAL(
        FACT, Set.of(Dimension.MATERIAL), factColumns(FD_MATERIAL.column("CONTEXT_NAME"), FD_MATERIAL.column("CONTEXT_MATERIAL_CODE")),
        FD_MATERIAL.column("CONTEXT_NAME"), FD_MATERIAL.column("CONTEXT_MATERIAL_CODE"), FD_MATERIAL.column("MATERIAL_TYPE"),
        FD_MATERIAL.column("MATERIAL_NAME"), FACT.column("AGE_IN_DAYS"), null, FilterExpression.always()
    ),
    ENCOUNTER(
        FACT, Set.of(Dimension.ENCOUNTER),
        List.of(
            D_PERSON.column("MEDICAL_RECORD_NUMBER"), FACT.column("AGE_IN_DAYS"), D_ENCOUNTER.column("ENCOUNTER_TYPE"),
            D_ENCOUNTER.column("ENCOUNTER_CLASS"), D_ENCOUNTER.column("BEGIN_DATE_AGE_IN_DAYS"), D_ENCOUNTER.column("END_DATE_AGE_IN_DAYS")
        ),
        null, D_ENCOUNTER.column("ENCOUNTER_TYPE"), D_ENCOUNTER.column("ENCOUNTER_TYPE"), D_ENCOUNTER.column("ENCOUNTER_TYPE"),
        FACT.column("AGE_IN_DAYS"), null, FilterExpression.always()
    ),
    METADATA(
        FACT, Set.of(Dimension.METADATA),
        List.of(
            D_PERSON.column("MEDICAL_RECORD_NUMBER"), FACT.column("AGE_IN_DAYS"), D_METADATA.column("LEVEL3"), D_METADATA.column("LEVEL4"),
            FACT.column("VALUE")
        ),
        null, null, null, null, FACT.column("AGE_IN_DAYS"), null, FilterExpression.always()
    ),
    LAB(
        EPIC_LAB, Set.of(),
        List.of(
            EPIC_LAB.column("MEDICAL_RECORD_NUMBER"), EPIC_LAB.column("AGE_IN_DAYS"), EPIC_LAB.column("TEST_NAME"),
            EPIC_LAB.column("ABNORMAL_FLAG"), EPIC_LAB.column("RESULT_FLAG"), EPIC_LAB.column("NUMERIC_VALUE"),
            EPIC_LAB.column("UNIT_OF_MEASUREMENT")
        ),
        null, EPIC_LAB.column("TEST_CODE"), null, EPIC_LAB.column("TEST_NAME"), EPIC_LAB.column("AGE_IN_DAYS"),
        EPIC_LAB.column("NUMERIC_VALUE"), FilterExpression.always()
    );

    private final Relation baseRelation;
    private final Set<Dimension> dimensions;
    private final List<ColumnRef> defaultColumns;
    private final ColumnRef contextColumn;
    private final ColumnRef codeColumn;
    private final ColumnRef categoryColumn;
    private final ColumnRef descriptionColumn;
    private final ColumnRef ageColumn;
    private final ColumnRef valueColumn;
    private final FilterExpression baseFilter;

    CriterionDomain(
        Relation baseRelation, Set<Dimension> dimensions, List<ColumnRef> defaultColumns, ColumnRef contextColumn, ColumnRef codeColumn,
        ColumnRef categoryColumn, ColumnRef descriptionColumn, ColumnRef ageColumn, ColumnRef valueColumn, FilterExpression baseFilter
    ) {
        this.baseRelation = baseRelation;
        this.dimensions = dimensions.isEmpty() ? Set.of() : Sets.immutableEnumSet(dimensions);
        this.defaultColumns = ImmutableList.copyOf(defaultColumns);
        this.contextColumn = contextColumn;
        this.codeColumn = codeColumn;
        this.categoryColumn = categoryColumn;
        this.descriptionColumn = descriptionColumn;
        this.ageColumn = ageColumn;
        this.valueColumn = valueColumn;
        this.baseFilter = baseFilter;
    }

    private static List<ColumnRef> factColumns(ColumnRef context, ColumnRef code) {
        return List.of(D_PERSON.column("MEDICAL_RECORD_NUMBER"), FACT.column("AGE_IN_DAYS"), context, code);
    }

    public Relation getBaseRelation() {
        return baseRelation;
    }

    public Set<Dimension> getDimensions() {
        return dimensions;
    }

    public List<ColumnRef> getDefaultColumns() {
        return defaultColumns;
    }

    public FilterExpression getBaseFilter() {
        return baseFilter;
    }

    public ColumnRef contextColumn() {
        return require(contextColumn, "context");
    }

    public ColumnRef codeColumn() {
        return require(codeColumn, "code");
    }

    public ColumnRef categoryColumn() {
        return require(categoryColumn, "category");
    }

    public ColumnRef descriptionColumn() {
        return require(descriptionColumn, "description");
    }

    public ColumnRef ageColumn() {
        return require(ageColumn, "age");
    }

    public ColumnRef valueColumn() {
        return require(valueColumn, "numeric value");
    }

    public boolean supportsAge() {
        return ageColumn != null;
    }

    public boolean supportsValueComparison() {
        return valueColumn != null;
    }

    private ColumnRef require(ColumnRef column, String attribute) {
        if (column == null) {
            throw new NotImplementedBehaviorException(name() + " criteria have no " + attribute + " column");
        }
        return column;
    }
}
