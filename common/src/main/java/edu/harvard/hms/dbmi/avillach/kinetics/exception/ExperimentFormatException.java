package edu.harvard.hms.dbmi.avillach.kinetics.exception;

/**
 * Thrown when an experiment document cannot be turned into simulations. Fatal for the offending
 * document only; callers loading many documents catch this per document and carry on.
 */
public class ExperimentFormatException extends RuntimeException {

	private static final long serialVersionUID = 6310957743061946725L;

	public ExperimentFormatException(String message) {
		super(message);
	}

	public ExperimentFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
