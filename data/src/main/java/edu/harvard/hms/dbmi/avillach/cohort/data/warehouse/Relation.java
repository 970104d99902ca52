package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * The relations of the clinical star schema that criteria can filter against or join in.
 */
public enum Relation {

    D_PERSON(
        "PERSON_KEY", "MEDICAL_RECORD_NUMBER", "DATE_OF_BIRTH", "MONTH_OF_BIRTH", "GENDER", "RELIGION", "RACE", "PATIENT_ETHNIC_GROUP",
        "DECEASED_INDICATOR", "MOTHER_ACCOUNT_NUMBER", "ADDRESS_ZIP", "MARITAL_STATUS_CODE", "ACTIVE_FLAG"
    ),
    FACT(
        "PERSON_KEY", "AGE_IN_DAYS", "TIME_OF_DAY_KEY", "DIAGNOSIS_GROUP_KEY", "PROCEDURE_GROUP_KEY", "MATERIAL_GROUP_KEY", "UOM_KEY",
        "ENCOUNTER_KEY", "META_DATA_KEY", "VALUE", "NUMERIC_VALUE"
    ),
    B_DIAGNOSIS("DIAGNOSIS_GROUP_KEY", "DIAGNOSIS_KEY"),
    FD_DIAGNOSIS("DIAGNOSIS_KEY", "CONTEXT_NAME", "CONTEXT_DIAGNOSIS_CODE", "DIAGNOSIS_TYPE", "DESCRIPTION"),
    B_PROCEDURE("PROCEDURE_GROUP_KEY", "PROCEDURE_KEY"),
    FD_PROCEDURE("PROCEDURE_KEY", "CONTEXT_NAME", "CONTEXT_PROCEDURE_CODE", "PROCEDURE_TYPE", "PROCEDURE_DESCRIPTION"),
    B_MATERIAL("MATERIAL_GROUP_KEY", "MATERIAL_KEY"),
    FD_MATERIAL(
        "MATERIAL_KEY", "CONTEXT_NAME", "CONTEXT_MATERIAL_CODE", "MATERIAL_TYPE", "MATERIAL_NAME", "GENERIC_NAME", "BRAND1", "BRAND2"
    ),
    D_UNIT_OF_MEASURE("UOM_KEY", "UNIT_OF_MEASURE"),
    D_ENCOUNTER("ENCOUNTER_KEY", "ENCOUNTER_TYPE", "ENCOUNTER_CLASS", "BEGIN_DATE_AGE_IN_DAYS", "END_DATE_AGE_IN_DAYS"),
    D_METADATA("META_DATA_KEY", "LEVEL1", "LEVEL2", "LEVEL3", "LEVEL4"),
    EPIC_LAB(
        "MEDICAL_RECORD_NUMBER", "AGE_IN_DAYS", "TEST_NAME", "TEST_CODE", "ABNORMAL_FLAG", "RESULT_FLAG", "NUMERIC_VALUE",
        "UNIT_OF_MEASUREMENT"
    );

    public static final String MEDICAL_RECORD_NUMBER = "MEDICAL_RECORD_NUMBER";

    private final Set<String> columns;

    Relation(String... columns) {
        this.columns = ImmutableSet.copyOf(columns);
    }

    public Set<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public ColumnRef column(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Relation " + name() + " has no column " + column);
        }
        return new ColumnRef(this, column);
    }

    /**
     * Relations that do not carry the medical record number themselves reach it through {@link #D_PERSON}.
     */
    public boolean requiresPersonJoin() {
        return !hasColumn(MEDICAL_RECORD_NUMBER);
    }

    public ColumnRef identifierColumn() {
        return requiresPersonJoin() ? D_PERSON.column(MEDICAL_RECORD_NUMBER) : column(MEDICAL_RECORD_NUMBER);
    }
}
