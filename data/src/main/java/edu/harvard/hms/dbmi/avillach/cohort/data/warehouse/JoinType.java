package edu.harvard.hms.dbmi.avillach.cohort.data.warehouse;

public enum JoinType {
    INNER, LEFT
}
