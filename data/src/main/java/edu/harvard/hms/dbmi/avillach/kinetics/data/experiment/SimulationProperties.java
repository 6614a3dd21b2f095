package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Initial conditions of a single simulation. Quantities are scalars except {@code time} and {@code volume}, which hold the
 * whole volume history of the case when the experiment supplies one.
 *
 * @param id            {@code <file stem>_<row index>}, unique within the source document
 * @param dataFile      name of the document the case came from
 * @param temperature   initial temperature
 * @param pressure      initial pressure; absent only when a volume history drives the case instead
 * @param pressureRise  measured pressure rise, shared by every case of the document
 * @param composition   species to fraction, fractions kept as written
 * @param ignitionDelay measured ignition delay, in the units of its data column
 * @param time          time points of the volume history
 * @param volume        volume history
 * @param reference     bibliographic source of the measurement
 */
public record SimulationProperties(
    @Nonnull String id, @Nonnull String dataFile, @Nonnull Quantity temperature, @Nullable Quantity pressure,
    @Nullable Quantity pressureRise, @Nonnull Map<String, String> composition, @Nullable Quantity ignitionDelay,
    @Nullable Quantity time, @Nullable Quantity volume, @Nullable String reference
) {

    public static final String ID = "id";
    public static final String DATA_FILE = "data file";

    public SimulationProperties {
        Objects.requireNonNull(id, ID);
        Objects.requireNonNull(dataFile, DATA_FILE);
        Objects.requireNonNull(temperature, ExperimentProperties.TEMPERATURE);
        composition = ImmutableMap.copyOf(composition);
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(ID);
        keys.add(DATA_FILE);
        keys.add(ExperimentProperties.TEMPERATURE);
        if (pressure != null) keys.add(ExperimentProperties.PRESSURE);
        if (pressureRise != null) keys.add(ExperimentProperties.PRESSURE_RISE);
        if (!composition.isEmpty()) keys.add(ExperimentProperties.COMPOSITION);
        if (ignitionDelay != null) keys.add(ExperimentProperties.IGNITION_DELAY);
        if (time != null) keys.add(ExperimentProperties.TIME);
        if (volume != null) keys.add(ExperimentProperties.VOLUME);
        if (reference != null) keys.add(ExperimentProperties.REFERENCE);
        return keys;
    }
}
