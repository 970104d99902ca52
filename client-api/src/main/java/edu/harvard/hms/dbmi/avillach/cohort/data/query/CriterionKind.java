package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The kinds of leaf criteria. The class name is the {@code class} entry of the dictionary form.
 */
public enum CriterionKind {
    PATIENT("Patient", CriterionDomain.PATIENT, PatientParameters.class, PatientParameters::fromAttributes),
    DIAGNOSIS("Diagnosis", CriterionDomain.DIAGNOSIS, FactParameters.class, FactParameters::fromAttributes),
    PROCEDURE("Procedure", CriterionDomain.PROCEDURE, FactParameters.class, FactParameters::fromAttributes),
    MEASUREMENT("Measurement", CriterionDomain.MEASUREMENT, FactParameters.class, FactParameters::fromAttributes),
    VITAL_SIGN("VitalSign", CriterionDomain.MEASUREMENT, FactParameters.class, FactParameters::fromAttributes),
    HEIGHT("Height", CriterionDomain.MEASUREMENT, FactParameters.class, FactParameters::fromAttributes),
    WEIGHT("Weight", CriterionDomain.MEASUREMENT, FactParameters.class, FactParameters::fromAttributes),
    MATERIAL("Material", CriterionDomain.MATERIAL, FactParameters.class, FactParameters::fromAttributes),
    DRUG("Drug", CriterionDomain.MATERIAL, DrugParameters.class, DrugParameters::fromAttributes),
    ENCOUNTER("Encounter", CriterionDomain.ENCOUNTER, FactParameters.class, FactParameters::fromAttributes),
    META_DATA("MetaData", CriterionDomain.METADATA, MetaDataParameters.class, MetaDataParameters::fromAttributes),
    ALCOHOL_USE("AlcoholUse", CriterionDomain.METADATA, MetaDataParameters.class, MetaDataParameters::fromAttributes),
    DRUG_USE("DrugUse", CriterionDomain.METADATA, MetaDataParameters.class, MetaDataParameters::fromAttributes),
    TOBACCO_USE("TobaccoUse", CriterionDomain.METADATA, TobaccoUseParameters.class, TobaccoUseParameters::fromAttributes),
    LAB_VALUE("LabValue", CriterionDomain.LAB, LabValueParameters.class, LabValueParameters::fromAttributes);

    private final String className;
    private final CriterionDomain domain;
    private final Class<? extends CriterionParameters> parameterType;
    private final Function<Map<String, ?>, ? extends CriterionParameters> reader;

    CriterionKind(
        String className, CriterionDomain domain, Class<? extends CriterionParameters> parameterType,
        Function<Map<String, ?>, ? extends CriterionParameters> reader
    ) {
        this.className = className;
        this.domain = domain;
        this.parameterType = parameterType;
        this.reader = reader;
    }

    public String getClassName() {
        return className;
    }

    public CriterionDomain getDomain() {
        return domain;
    }

    public Class<? extends CriterionParameters> getParameterType() {
        return parameterType;
    }

    CriterionParameters readParameters(Map<String, ?> attributes) {
        return reader.apply(attributes);
    }

    public static Optional<CriterionKind> fromClassName(String className) {
        return Arrays.stream(values()).filter(kind -> kind.className.equals(className)).findFirst();
    }
}
