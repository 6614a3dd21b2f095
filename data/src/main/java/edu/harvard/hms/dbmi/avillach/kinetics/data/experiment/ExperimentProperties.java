package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything read out of one experiment document, before it is split into simulations. Each extraction stage fills in
 * the fields it knows about; nothing is ever cleared. Instances are owned by a single document load and are not shared
 * between threads.
 */
public class ExperimentProperties {

    public static final String KIND = "kind";
    public static final String PRESSURE = "pressure";
    public static final String PRESSURE_RISE = "pressure rise";
    public static final String COMPOSITION = "composition";
    public static final String IGNITION_TARGET = "ignition target";
    public static final String IGNITION_TYPE = "ignition type";
    public static final String IGNITION_TARGET_VALUE = "ignition target value";
    public static final String TEMPERATURE = "temperature";
    public static final String IGNITION_DELAY = "ignition delay";
    public static final String TIME = "time";
    public static final String VOLUME = "volume";
    public static final String REFERENCE = "reference";
    public static final String FILE_AUTHOR = "file author";

    private ExperimentKind kind;
    private Quantity pressure;
    private Quantity pressureRise;
    // species -> fraction, as written in the document
    private final Map<String, String> composition = new LinkedHashMap<>();
    private String ignitionTarget;
    private IgnitionType ignitionType;
    private Double ignitionTargetValue;
    private Quantity temperature;
    private Quantity ignitionDelay;
    private Quantity time;
    private Quantity volume;
    private String reference;
    private String fileAuthor;

    public ExperimentKind getKind() {
        return kind;
    }

    public ExperimentProperties setKind(ExperimentKind kind) {
        this.kind = kind;
        return this;
    }

    public Quantity getPressure() {
        return pressure;
    }

    public ExperimentProperties setPressure(Quantity pressure) {
        this.pressure = pressure;
        return this;
    }

    public Quantity getPressureRise() {
        return pressureRise;
    }

    public ExperimentProperties setPressureRise(Quantity pressureRise) {
        this.pressureRise = pressureRise;
        return this;
    }

    public Map<String, String> getComposition() {
        return Collections.unmodifiableMap(composition);
    }

    /**
     * Adds one species to the initial composition. A species seen twice keeps the fraction it was given last.
     */
    public ExperimentProperties putComponent(String species, String fraction) {
        composition.put(species, fraction);
        return this;
    }

    public String getIgnitionTarget() {
        return ignitionTarget;
    }

    public ExperimentProperties setIgnitionTarget(String ignitionTarget) {
        this.ignitionTarget = ignitionTarget;
        return this;
    }

    public IgnitionType getIgnitionType() {
        return ignitionType;
    }

    public ExperimentProperties setIgnitionType(IgnitionType ignitionType) {
        this.ignitionType = ignitionType;
        return this;
    }

    public @Nullable Double getIgnitionTargetValue() {
        return ignitionTargetValue;
    }

    public ExperimentProperties setIgnitionTargetValue(@Nullable Double ignitionTargetValue) {
        this.ignitionTargetValue = ignitionTargetValue;
        return this;
    }

    public Quantity getTemperature() {
        return temperature;
    }

    public ExperimentProperties setTemperature(Quantity temperature) {
        this.temperature = temperature;
        return this;
    }

    public Quantity getIgnitionDelay() {
        return ignitionDelay;
    }

    public ExperimentProperties setIgnitionDelay(Quantity ignitionDelay) {
        this.ignitionDelay = ignitionDelay;
        return this;
    }

    public Quantity getTime() {
        return time;
    }

    public ExperimentProperties setTime(Quantity time) {
        this.time = time;
        return this;
    }

    public Quantity getVolume() {
        return volume;
    }

    public ExperimentProperties setVolume(Quantity volume) {
        this.volume = volume;
        return this;
    }

    public String getReference() {
        return reference;
    }

    public ExperimentProperties setReference(String reference) {
        this.reference = reference;
        return this;
    }

    public String getFileAuthor() {
        return fileAuthor;
    }

    public ExperimentProperties setFileAuthor(String fileAuthor) {
        this.fileAuthor = fileAuthor;
        return this;
    }

    /**
     * @return the names of the properties that have been set so far
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        if (kind != null) keys.add(KIND);
        if (pressure != null) keys.add(PRESSURE);
        if (pressureRise != null) keys.add(PRESSURE_RISE);
        if (!composition.isEmpty()) keys.add(COMPOSITION);
        if (ignitionTarget != null) keys.add(IGNITION_TARGET);
        if (ignitionType != null) keys.add(IGNITION_TYPE);
        if (ignitionTargetValue != null) keys.add(IGNITION_TARGET_VALUE);
        if (temperature != null) keys.add(TEMPERATURE);
        if (ignitionDelay != null) keys.add(IGNITION_DELAY);
        if (time != null) keys.add(TIME);
        if (volume != null) keys.add(VOLUME);
        if (reference != null) keys.add(REFERENCE);
        if (fileAuthor != null) keys.add(FILE_AUTHOR);
        return keys;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExperimentProperties that = (ExperimentProperties) o;
        return kind == that.kind && Objects.equals(pressure, that.pressure) && Objects.equals(pressureRise, that.pressureRise)
            && composition.equals(that.composition) && Objects.equals(ignitionTarget, that.ignitionTarget)
            && ignitionType == that.ignitionType && Objects.equals(ignitionTargetValue, that.ignitionTargetValue)
            && Objects.equals(temperature, that.temperature) && Objects.equals(ignitionDelay, that.ignitionDelay)
            && Objects.equals(time, that.time) && Objects.equals(volume, that.volume) && Objects.equals(reference, that.reference)
            && Objects.equals(fileAuthor, that.fileAuthor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            kind, pressure, pressureRise, composition, ignitionTarget, ignitionType, ignitionTargetValue, temperature, ignitionDelay,
            time, volume, reference, fileAuthor
        );
    }

    @Override
    public String toString() {
        return "ExperimentProperties{kind=" + kind + ", keys=" + keys() + "}";
    }
}
