package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.table.Occurrence;

import java.util.Collection;

/**
 * Factory methods for the supported criteria.
 */
public final class Criteria {

    public static final String VITAL_SIGNS = "Vital Signs";

    private Criteria() {
    }

    public static Criterion patient() {
        return patient(null, null, null);
    }

    public static Criterion patient(String gender, String religion, String race) {
        return new Criterion(CriterionKind.PATIENT, new PatientParameters(gender, religion, race));
    }

    public static Criterion diagnosis(String code, String context) {
        return diagnosis(FactParameters.ofCode(code, context));
    }

    public static Criterion diagnosis(FactParameters parameters) {
        return new Criterion(CriterionKind.DIAGNOSIS, parameters);
    }

    public static Criterion procedure(String code, String context) {
        return procedure(FactParameters.ofCode(code, context));
    }

    public static Criterion procedure(FactParameters parameters) {
        return new Criterion(CriterionKind.PROCEDURE, parameters);
    }

    public static Criterion measurement(String description) {
        return measurement(FactParameters.ofDescription(description));
    }

    public static Criterion measurement(FactParameters parameters) {
        return new Criterion(CriterionKind.MEASUREMENT, parameters);
    }

    public static Criterion vitalSign(String description) {
        return new Criterion(CriterionKind.VITAL_SIGN, new FactParameters(null, null, VITAL_SIGNS, description));
    }

    public static Criterion height() {
        return new Criterion(CriterionKind.HEIGHT, FactParameters.ofDescription("HEIGHT"));
    }

    public static Criterion weight() {
        return new Criterion(CriterionKind.WEIGHT, FactParameters.ofDescription("WEIGHT"));
    }

    public static Criterion material(FactParameters parameters) {
        return new Criterion(CriterionKind.MATERIAL, parameters);
    }

    public static Criterion drug(String name) {
        return new Criterion(CriterionKind.DRUG, new DrugParameters(name, null, null));
    }

    public static Criterion drug(String name, String code, String context) {
        return new Criterion(CriterionKind.DRUG, new DrugParameters(name, code, context));
    }

    public static Criterion encounter(String category) {
        return new Criterion(CriterionKind.ENCOUNTER, FactParameters.ofCategory(category));
    }

    public static Criterion metaData(String name) {
        return new Criterion(CriterionKind.META_DATA, new MetaDataParameters(name));
    }

    public static Criterion alcoholUse() {
        return new Criterion(CriterionKind.ALCOHOL_USE, new MetaDataParameters(MetaDataParameters.ALCOHOL_USE));
    }

    public static Criterion drugUse() {
        return new Criterion(CriterionKind.DRUG_USE, new MetaDataParameters(MetaDataParameters.DRUG_USE));
    }

    public static Criterion tobaccoUse(TobaccoUseType use) {
        return new Criterion(CriterionKind.TOBACCO_USE, new TobaccoUseParameters(use));
    }

    public static Criterion labValue(String name) {
        return labValue(name, null);
    }

    public static Criterion labValue(String name, Boolean abnormal) {
        return new Criterion(CriterionKind.LAB_VALUE, new LabValueParameters(name, abnormal));
    }

    public static IdentifierListPredicate identifiers(Collection<?> identifiers) {
        return IdentifierListPredicate.ofIdentifiers(identifiers);
    }

    public static IdentifierListPredicate occurrences(Collection<Occurrence> occurrences) {
        return new IdentifierListPredicate(occurrences);
    }
}
