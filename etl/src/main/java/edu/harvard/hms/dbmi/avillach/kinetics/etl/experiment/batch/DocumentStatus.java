package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.batch;

import edu.harvard.hms.dbmi.avillach.kinetics.data.experiment.Simulation;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of loading one experiment document.
 *
 * @param file        the document
 * @param simulations simulations built from it, empty when it failed
 * @param failure     why the document could not be loaded, null on success
 * @param nanos       time spent on the document
 */
public record DocumentStatus(Path file, List<Simulation> simulations, @Nullable RuntimeException failure, long nanos) {

    public static DocumentStatus success(Path file, List<Simulation> simulations, long nanos) {
        return new DocumentStatus(file, List.copyOf(simulations), null, nanos);
    }

    public static DocumentStatus failure(Path file, RuntimeException failure, long nanos) {
        return new DocumentStatus(file, List.of(), failure, nanos);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public static int simulationCount(List<DocumentStatus> statuses) {
        return statuses.stream().mapToInt(status -> status.simulations().size()).sum();
    }
}
