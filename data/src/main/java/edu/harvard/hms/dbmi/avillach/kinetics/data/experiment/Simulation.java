package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One fully specified initial value case built from an experiment document, together with the rule used to find
 * ignition in its simulated trace.
 *
 * @param ignitionTarget      species name, or {@code P} / {@code T} for pressure and temperature
 * @param ignitionTargetValue threshold of the ignition target, when the document gives one
 */
public record Simulation(
    @Nonnull ExperimentKind kind, @Nonnull SimulationProperties properties, @Nonnull String ignitionTarget,
    @Nonnull IgnitionType ignitionType, @Nullable Double ignitionTargetValue
) {

    public Simulation {
        Objects.requireNonNull(kind, ExperimentProperties.KIND);
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(ignitionTarget, ExperimentProperties.IGNITION_TARGET);
        Objects.requireNonNull(ignitionType, ExperimentProperties.IGNITION_TYPE);
    }

    public String id() {
        return properties.id();
    }

    public String getIgnitionTypeLabel() {
        return ignitionType.getLabel();
    }
}
