package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Quantity;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Data group columns this loader understands, keyed by the column {@code name} attribute.
 */
public enum SeriesKey {
    TIME(ExperimentProperties.TIME, ExperimentProperties::setTime),
    TEMPERATURE(ExperimentProperties.TEMPERATURE, ExperimentProperties::setTemperature),
    PRESSURE(ExperimentProperties.PRESSURE, ExperimentProperties::setPressure),
    VOLUME(ExperimentProperties.VOLUME, ExperimentProperties::setVolume),
    IGNITION_DELAY(ExperimentProperties.IGNITION_DELAY, ExperimentProperties::setIgnitionDelay);

    private final String columnName;
    private final BiConsumer<ExperimentProperties, Quantity> setter;

    SeriesKey(String columnName, BiConsumer<ExperimentProperties, Quantity> setter) {
        this.columnName = columnName;
        this.setter = setter;
    }

    public String getColumnName() {
        return columnName;
    }

    void applyTo(ExperimentProperties properties, Quantity quantity) {
        setter.accept(properties, quantity);
    }

    public static Optional<SeriesKey> fromColumnName(String columnName) {
        return Arrays.stream(values()).filter(key -> key.columnName.equals(columnName)).findFirst();
    }
}
