package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ExperimentKind {
    SHOCK_TUBE("ST", "shock tube"),
    RAPID_COMPRESSION_MACHINE("RCM", "rapid compression machine");

    private final String code;
    private final String apparatus;

    ExperimentKind(String code, String apparatus) {
        this.code = code;
        this.apparatus = apparatus;
    }

    public String getCode() {
        return code;
    }

    public String getApparatus() {
        return apparatus;
    }

    /**
     * Matches the apparatus kind tag of a document, ignoring case and surrounding whitespace.
     */
    public static Optional<ExperimentKind> fromApparatus(String apparatus) {
        if (apparatus == null) {
            return Optional.empty();
        }
        String normalized = apparatus.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(kind -> kind.apparatus.equals(normalized)).findFirst();
    }
}
