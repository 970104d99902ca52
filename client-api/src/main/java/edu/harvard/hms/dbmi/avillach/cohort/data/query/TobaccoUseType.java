package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import java.util.List;
import java.util.Optional;

/**
 * Kinds of tobacco use and the values the warehouse records for each of them.
 */
public enum TobaccoUseType {
    YES(
        "Yes", "Current Every Day Smoker", "Current Some Day Smoker", "Current Everyday Smoker", "Light Tobacco Smoker",
        "Heavy Tobacco Smoker", "Smoker, Current Status Unknown"
    ),
    NO("Never Smoker", "Never"),
    FORMER("Former Smoker", "Quit"),
    UNKNOWN("Never Assessed", "Not Asked", "Unknown If Ever Smoked"),
    PASSIVE("Passive Smoke Exposure - Never Smoker", "Passive", "Passive Smoker");

    private final List<String> recordedValues;

    TobaccoUseType(String... recordedValues) {
        this.recordedValues = List.of(recordedValues);
    }

    public List<String> getRecordedValues() {
        return recordedValues;
    }

    public static Optional<TobaccoUseType> classify(String recordedValue) {
        for (TobaccoUseType type : values()) {
            if (type.recordedValues.contains(recordedValue)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
