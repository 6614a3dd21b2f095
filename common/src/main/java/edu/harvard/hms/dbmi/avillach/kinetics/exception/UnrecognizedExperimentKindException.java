package edu.harvard.hms.dbmi.avillach.kinetics.exception;

public class UnrecognizedExperimentKindException extends ExperimentFormatException {

	private static final long serialVersionUID = -4271166009428518374L;

	public UnrecognizedExperimentKindException(String declaredKind) {
		super("Experiment kind \"" + declaredKind + "\" is not supported. "
				+ "Only shock tube and rapid compression machine ignition delay measurements can be loaded.");
	}
}
