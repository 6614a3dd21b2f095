package edu.harvard.hms.dbmi.avillach.kinetics.exception;

public class InconsistentSeriesLengthException extends ExperimentFormatException {

	private static final long serialVersionUID = -7796205358164380933L;

	private final String series;
	private final int length;
	private final int expectedLength;

	/**
	 * @param series         name of the offending series
	 * @param length         number of values the series actually has
	 * @param expectedLength number of rows the rest of the document implies
	 */
	public InconsistentSeriesLengthException(String series, int length, int expectedLength) {
		super("Series \"" + series + "\" has " + length + " values but the document describes "
				+ expectedLength + " data points. Refusing to truncate or pad it.");
		this.series = series;
		this.length = length;
		this.expectedLength = expectedLength;
	}

	public String getSeries() {
		return series;
	}

	public int getLength() {
		return length;
	}

	public int getExpectedLength() {
		return expectedLength;
	}
}
