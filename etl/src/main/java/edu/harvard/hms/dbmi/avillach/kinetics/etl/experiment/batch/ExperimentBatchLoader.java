package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.batch;

import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.ExperimentReader;
import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config.ParserConfig;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.ExperimentFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Loads many experiment documents, one document per task. A document that cannot be loaded is reported in its
 * {@link DocumentStatus} and does not stop the others. Failed documents are not retried.
 */
public class ExperimentBatchLoader {

    private static final Logger log = LoggerFactory.getLogger(ExperimentBatchLoader.class);

    private final ExperimentReader reader;
    private final int workerThreads;

    public ExperimentBatchLoader(ParserConfig config) {
        this(new ExperimentReader(config), config.getWorker_threads());
    }

    public ExperimentBatchLoader(ExperimentReader reader, int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1, got " + workerThreads);
        }
        this.reader = reader;
        this.workerThreads = workerThreads;
    }

    /**
     * @return one status per input file, in input order
     */
    public List<DocumentStatus> load(Collection<Path> experimentFiles) {
        long startTime = System.nanoTime();
        log.info("Loading {} experiment files with {} worker threads", experimentFiles.size(), workerThreads);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(workerThreads, experimentFiles.size())));
        try {
            List<Path> files = List.copyOf(experimentFiles);
            List<Future<DocumentStatus>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> loadOne(file)));
            }

            List<DocumentStatus> statuses = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                statuses.add(collect(files.get(i), futures.get(i), startTime));
            }

            long failed = statuses.stream().filter(status -> !status.succeeded()).count();
            log.info(
                "Finished loading {} experiment files into {} simulations in {} ms, {} failed", statuses.size(),
                DocumentStatus.simulationCount(statuses), (System.nanoTime() - startTime) / 1_000_000, failed
            );
            return statuses;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading experiment files", e);
        } finally {
            executor.shutdownNow();
        }
    }

    DocumentStatus loadOne(Path file) {
        long startTime = System.nanoTime();
        try {
            DocumentStatus status = DocumentStatus.success(file, reader.readSimulations(file), System.nanoTime() - startTime);
            log.info("Loaded {} simulations from {}", status.simulations().size(), file.getFileName());
            return status;
        } catch (ExperimentFormatException | UncheckedIOException | IllegalArgumentException e) {
            log.warn("Could not load experiment file {}: {}", file, e.getMessage());
            return DocumentStatus.failure(file, e, System.nanoTime() - startTime);
        }
    }

    private DocumentStatus collect(Path file, Future<DocumentStatus> future, long batchStartTime) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // loadOne records expected document failures itself, this one is unexpected but still only fails its document
            Throwable cause = e.getCause();
            log.error("Unexpected failure loading experiment file {}", file, cause);
            RuntimeException failure = cause instanceof RuntimeException ? (RuntimeException) cause : new IllegalStateException(cause);
            return DocumentStatus.failure(file, failure, System.nanoTime() - batchStartTime);
        }
    }
}
