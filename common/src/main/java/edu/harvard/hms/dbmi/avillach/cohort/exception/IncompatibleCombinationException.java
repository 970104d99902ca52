package edu.harvard.hms.dbmi.avillach.cohort.exception;

public class IncompatibleCombinationException extends RuntimeException {

	private static final long serialVersionUID = -6339521787045132231L;

	public IncompatibleCombinationException(String message) {
		super(message);
	}
}
