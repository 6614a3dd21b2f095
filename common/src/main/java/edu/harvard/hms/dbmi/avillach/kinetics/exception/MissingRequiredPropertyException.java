package edu.harvard.hms.dbmi.avillach.kinetics.exception;

public class MissingRequiredPropertyException extends ExperimentFormatException {

	private static final long serialVersionUID = 8829532412785573102L;

	private final String property;

	public MissingRequiredPropertyException(String property, String experimentKind) {
		super("Required property \"" + property + "\" is missing for " + experimentKind + " experiment");
		this.property = property;
	}

	public String getProperty() {
		return property;
	}
}
