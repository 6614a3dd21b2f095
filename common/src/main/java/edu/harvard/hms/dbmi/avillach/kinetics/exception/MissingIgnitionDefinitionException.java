package edu.harvard.hms.dbmi.avillach.kinetics.exception;

public class MissingIgnitionDefinitionException extends ExperimentFormatException {

	private static final long serialVersionUID = 2030887127431151254L;

	public MissingIgnitionDefinitionException(String message) {
		super(message);
	}

	public MissingIgnitionDefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
