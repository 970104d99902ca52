package edu.harvard.hms.dbmi.avillach.cohort.exception;

public class UnsupportedChainingException extends RuntimeException {

	private static final long serialVersionUID = 2217834558701436649L;

	public UnsupportedChainingException() {
		super("Chaining of multiple comparisons not supported. Combine comparisons with an explicit and().");
	}
}
