package edu.harvard.hms.dbmi.avillach.cohort.processing.aggregation;

import java.util.Locale;

/**
 * Closed interval of time deltas in days, negative values lie before the anchor.
 */
public record TimeWindow(int start, int end) {

    public TimeWindow {
        if (start > end) {
            throw new IllegalArgumentException("Window start " + start + " is after window end " + end);
        }
    }

    public static TimeWindow of(int start, int end) {
        return new TimeWindow(start, end);
    }

    public boolean contains(Integer timeDelta) {
        return timeDelta != null && timeDelta >= start && timeDelta <= end;
    }

    /**
     * e.g. {@code creatinine_from_7_days_before_to_0_days_after} for "Creatinine" over (-7, 0).
     */
    public String intervalName(String name) {
        String prefix = name == null ? "" : name.toLowerCase(Locale.ROOT).replace(' ', '_');
        return prefix + "_from_" + describe(start) + "_to_" + describe(end);
    }

    private static String describe(int delta) {
        return Math.abs(delta) + "_days_" + (delta < 0 ? "before" : "after");
    }
}
