package edu.harvard.hms.dbmi.avillach.cohort.exception;

public class AmbiguousTemporalSelectorException extends RuntimeException {

	private static final long serialVersionUID = -3840915567298035512L;

	public AmbiguousTemporalSelectorException() {
		super("Exactly one of (relativeTo, before, after) must be supplied.");
	}
}
