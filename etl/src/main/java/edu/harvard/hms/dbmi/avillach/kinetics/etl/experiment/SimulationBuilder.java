package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentKind;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.ExperimentProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Quantity;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Simulation;
import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.SimulationProperties;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.InconsistentSeriesLengthException;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.MissingRequiredPropertyException;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the properties of one document into one simulation per data point.
 * <p>
 * Temperature, ignition delay and pressure are per-row: a series of length N gives element i to simulation i, a single
 * value is copied to every simulation. In a single-row document time and volume describe the evolution of the whole case
 * and are attached as they are. When the document has several rows, a time or volume series with one value per row is
 * indexed like the other per-row series. Everything else is shared by all simulations of the document.
 */
public class SimulationBuilder {

    private static final Logger log = LoggerFactory.getLogger(SimulationBuilder.class);

    /**
     * @param properties     fully extracted document properties
     * @param sourceFilename name of the document, used for the simulation ids and the {@code data file} property
     * @return simulations in row order, ids {@code <file stem>_0}, {@code <file stem>_1}, ...
     * @throws MissingRequiredPropertyException   if the experiment kind needs a property the document lacks
     * @throws InconsistentSeriesLengthException if two multi-valued series disagree on the number of rows
     */
    public List<Simulation> build(ExperimentProperties properties, String sourceFilename) {
        checkRequiredProperties(properties);

        Map<String, Quantity> perRowSeries = new LinkedHashMap<>();
        perRowSeries.put(ExperimentProperties.TEMPERATURE, properties.getTemperature());
        if (properties.getIgnitionDelay() != null) {
            perRowSeries.put(ExperimentProperties.IGNITION_DELAY, properties.getIgnitionDelay());
        }
        if (properties.getPressure() != null) {
            perRowSeries.put(ExperimentProperties.PRESSURE, properties.getPressure());
        }

        int rows = perRowSeries.values().stream().mapToInt(Quantity::size).max().orElse(1);
        for (Map.Entry<String, Quantity> series : perRowSeries.entrySet()) {
            int length = series.getValue().size();
            if (length != 1 && length != rows) {
                throw new InconsistentSeriesLengthException(series.getKey(), length, rows);
            }
        }
        checkHistory(properties, rows);

        String stem = FilenameUtils.getBaseName(sourceFilename);
        String dataFile = FilenameUtils.getName(sourceFilename);
        ImmutableList.Builder<Simulation> simulations = ImmutableList.builder();
        for (int row = 0; row < rows; row++) {
            SimulationProperties simulationProperties = new SimulationProperties(
                stem + "_" + row, dataFile, select(properties.getTemperature(), row), select(properties.getPressure(), row),
                properties.getPressureRise(), properties.getComposition(), select(properties.getIgnitionDelay(), row),
                history(properties.getTime(), rows, row), history(properties.getVolume(), rows, row), properties.getReference()
            );
            simulations.add(
                new Simulation(
                    properties.getKind(), simulationProperties, properties.getIgnitionTarget(), properties.getIgnitionType(),
                    properties.getIgnitionTargetValue()
                )
            );
        }
        log.debug("Built {} simulations from {}", rows, dataFile);
        return simulations.build();
    }

    private void checkRequiredProperties(ExperimentProperties properties) {
        ExperimentKind kind = properties.getKind();
        if (kind == null) {
            throw new MissingRequiredPropertyException(ExperimentProperties.KIND, "an unclassified");
        }
        String kindName = kind.getApparatus();
        if (properties.getTemperature() == null) {
            throw new MissingRequiredPropertyException(ExperimentProperties.TEMPERATURE, kindName);
        }
        if (properties.getComposition().isEmpty()) {
            throw new MissingRequiredPropertyException(ExperimentProperties.COMPOSITION, kindName);
        }
        if (properties.getIgnitionTarget() == null) {
            throw new MissingRequiredPropertyException(ExperimentProperties.IGNITION_TARGET, kindName);
        }
        if (properties.getIgnitionType() == null) {
            throw new MissingRequiredPropertyException(ExperimentProperties.IGNITION_TYPE, kindName);
        }
        if (properties.getPressure() == null) {
            // a rapid compression machine run can be driven by its volume history instead
            boolean hasVolumeHistory = properties.getTime() != null && properties.getVolume() != null;
            if (kind == ExperimentKind.SHOCK_TUBE || !hasVolumeHistory) {
                throw new MissingRequiredPropertyException(ExperimentProperties.PRESSURE, kindName);
            }
        }
    }

    private void checkHistory(ExperimentProperties properties, int rows) {
        Quantity time = properties.getTime();
        Quantity volume = properties.getVolume();
        if (time != null && volume != null && !time.isScalar() && !volume.isScalar() && time.size() != volume.size()) {
            throw new InconsistentSeriesLengthException(ExperimentProperties.VOLUME, volume.size(), time.size());
        }
        if (rows > 1) {
            for (Map.Entry<String, Quantity> history : historyEntries(time, volume).entrySet()) {
                int length = history.getValue().size();
                if (length > 1 && length != rows) {
                    throw new InconsistentSeriesLengthException(history.getKey(), length, rows);
                }
            }
        }
    }

    private static Map<String, Quantity> historyEntries(@Nullable Quantity time, @Nullable Quantity volume) {
        Map<String, Quantity> entries = new LinkedHashMap<>();
        if (time != null) {
            entries.put(ExperimentProperties.TIME, time);
        }
        if (volume != null) {
            entries.put(ExperimentProperties.VOLUME, volume);
        }
        return entries;
    }

    private static @Nullable Quantity history(@Nullable Quantity series, int rows, int row) {
        return rows > 1 ? select(series, row) : series;
    }

    private static @Nullable Quantity select(@Nullable Quantity series, int row) {
        if (series == null) {
            return null;
        }
        return series.isScalar() ? series : series.get(row);
    }
}
