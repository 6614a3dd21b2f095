package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import java.util.Arrays;
import java.util.Optional;

/**
 * How ignition is detected from a simulated trace of the ignition target.
 */
public enum IgnitionType {
    /** time of the maximum time-derivative */
    DERIVATIVE_MAX("d/dt max"),
    /** time of the maximum value */
    MAX("max");

    private final String label;

    IgnitionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<IgnitionType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values()).filter(type -> type.label.equals(trimmed)).findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
