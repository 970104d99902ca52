package edu.harvard.hms.dbmi.avillach.cohort.exception;

public class EmptyComparisonValueException extends RuntimeException {

	private static final long serialVersionUID = -1480257361229930412L;

	public EmptyComparisonValueException(String operator) {
		super("Comparison " + operator + " has no value to compare against");
	}
}
