package edu.harvard.hms.dbmi.avillach.cohort.processing;

import edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.InMemoryWarehouseClient;

import java.util.HashMap;
import java.util.Map;

import static edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.Relation.*;

/**
 * Four patients: A and B diagnosed with 584.9 (ICD-9), B and C with N17 (ICD-10), A and D with E11.9 (ICD-10). A has two creatinine
 * results five days after the ICD-9 diagnosis, B one result ten days before it.
 */
public final class Warehouses {

    private Warehouses() {
    }

    public static InMemoryWarehouseClient clinical() {
        InMemoryWarehouseClient warehouse = new InMemoryWarehouseClient()
            .insert(D_PERSON, person(1, "A", "Female", "White"))
            .insert(D_PERSON, person(2, "B", "Male", "Black Or African-American"))
            .insert(D_PERSON, person(3, "C", "Female", "White"))
            .insert(D_PERSON, person(4, "D", "Male", "Asian"))
            .insert(B_DIAGNOSIS, Map.of("DIAGNOSIS_GROUP_KEY", 10, "DIAGNOSIS_KEY", 100))
            .insert(B_DIAGNOSIS, Map.of("DIAGNOSIS_GROUP_KEY", 11, "DIAGNOSIS_KEY", 101))
            .insert(B_DIAGNOSIS, Map.of("DIAGNOSIS_GROUP_KEY", 12, "DIAGNOSIS_KEY", 102))
            .insert(FD_DIAGNOSIS, diagnosis(100, "ICD-9", "584.9", "Acute kidney failure"))
            .insert(FD_DIAGNOSIS, diagnosis(101, "ICD-10", "N17", "Acute kidney failure"))
            .insert(FD_DIAGNOSIS, diagnosis(102, "ICD-10", "E11.9", "Type 2 diabetes mellitus"))
            .insert(B_PROCEDURE, Map.of("PROCEDURE_GROUP_KEY", 20, "PROCEDURE_KEY", 200))
            .insert(FD_PROCEDURE, Map.of(
                "PROCEDURE_KEY", 200, "CONTEXT_NAME", "LOINC", "CONTEXT_PROCEDURE_CODE", "2160-0", "PROCEDURE_TYPE", "Lab",
                "PROCEDURE_DESCRIPTION", "Creatinine"
            ))
            .insert(D_UNIT_OF_MEASURE, Map.of("UOM_KEY", 1, "UNIT_OF_MEASURE", "mg/dL"));

        warehouse
            .insert(FACT, diagnosisFact(1, 100, 10))
            .insert(FACT, diagnosisFact(2, 200, 10))
            .insert(FACT, diagnosisFact(2, 210, 11))
            .insert(FACT, diagnosisFact(3, 300, 11))
            .insert(FACT, diagnosisFact(1, 90, 12))
            .insert(FACT, diagnosisFact(4, 400, 12))
            .insert(FACT, measurementFact(1, 105, 1.1))
            .insert(FACT, measurementFact(1, 105, 1.3))
            .insert(FACT, measurementFact(2, 190, 0.9));
        return warehouse;
    }

    private static Map<String, Object> person(int key, String mrn, String gender, String race) {
        Map<String, Object> person = new HashMap<>();
        person.put("PERSON_KEY", key);
        person.put("MEDICAL_RECORD_NUMBER", mrn);
        person.put("GENDER", gender);
        person.put("RACE", race);
        person.put("ACTIVE_FLAG", "Y");
        return person;
    }

    private static Map<String, Object> diagnosis(int key, String context, String code, String description) {
        return Map.of("DIAGNOSIS_KEY", key, "CONTEXT_NAME", context, "CONTEXT_DIAGNOSIS_CODE", code, "DESCRIPTION", description,
            "DIAGNOSIS_TYPE", "Diagnosis");
    }

    private static Map<String, Object> diagnosisFact(int person, int age, int group) {
        return Map.of("PERSON_KEY", person, "AGE_IN_DAYS", age, "DIAGNOSIS_GROUP_KEY", group);
    }

    private static Map<String, Object> measurementFact(int person, int age, double value) {
        return Map.of("PERSON_KEY", person, "AGE_IN_DAYS", age, "PROCEDURE_GROUP_KEY", 20, "UOM_KEY", 1, "NUMERIC_VALUE", value);
    }
}
