package edu.harvard.hms.dbmi.avillach.cohort.exception;

/**
 * A stored cohort definition could not be turned back into a predicate.
 */
public class MalformedSerializationException extends RuntimeException {

	private static final long serialVersionUID = 7706240318932147553L;

	public MalformedSerializationException(String message) {
		super(message);
	}

	public MalformedSerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
