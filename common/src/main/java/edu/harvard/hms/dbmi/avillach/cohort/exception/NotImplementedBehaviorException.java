package edu.harvard.hms.dbmi.avillach.cohort.exception;

/**
 * Raised when a criterion is asked for a capability its domain does not declare, for example an age constraint on a relation
 * without an age column.
 */
public class NotImplementedBehaviorException extends RuntimeException {

	private static final long serialVersionUID = 4127763094512807716L;

	public NotImplementedBehaviorException(String message) {
		super(message);
	}
}
