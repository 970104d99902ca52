package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import edu.harvard.hms.dbmi.avillach.cohort.data.filter.ComparisonOperator;

public record ValueComparison(ComparisonOperator operator, Double value) {
}
