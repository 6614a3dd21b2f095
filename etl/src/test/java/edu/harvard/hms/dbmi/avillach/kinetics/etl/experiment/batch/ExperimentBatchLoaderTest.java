package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.batch;

import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.ExperimentReader;
import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config.ParserConfig;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.InconsistentSeriesLengthException;
import edu.harvard.hms.dbmi.avillach.kinetics.exception.UnrecognizedExperimentKindException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

class ExperimentBatchLoaderTest {

    private static Path copyFixture(String fixture, Path testDir) throws IOException {
        Path target = testDir.resolve(fixture);
        try (InputStream in = new ClassPathResource("experiments/" + fixture).getInputStream()) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void shouldLoadEveryDocumentAndKeepInputOrder(@TempDir Path testDir) throws IOException {
        Path st = copyFixture("testfile_st.xml", testDir);
        Path st2 = copyFixture("testfile_st2.xml", testDir);
        Path rcm = copyFixture("testfile_rcm.xml", testDir);

        ParserConfig config = new ParserConfig();
        config.setWorker_threads(2);
        List<DocumentStatus> statuses = new ExperimentBatchLoader(config).load(List.of(rcm, st, st2));

        Assertions.assertEquals(List.of(rcm, st, st2), statuses.stream().map(DocumentStatus::file).toList());
        Assertions.assertTrue(statuses.stream().allMatch(DocumentStatus::succeeded));
        Assertions.assertEquals(4, DocumentStatus.simulationCount(statuses));
        Assertions.assertEquals("testfile_rcm_0", statuses.get(0).simulations().get(0).id());
    }

    @Test
    void shouldContinuePastFailedDocuments(@TempDir Path testDir) throws IOException {
        Path st = copyFixture("testfile_st.xml", testDir);
        Path inconsistent = copyFixture("testfile_inconsistent_rcm.xml", testDir);
        Path flowReactor = testDir.resolve("flow_reactor.xml");
        Files.writeString(flowReactor, "<experiment><apparatus><kind>flow reactor</kind></apparatus></experiment>");
        Path missing = testDir.resolve("missing.xml");

        List<DocumentStatus> statuses =
            new ExperimentBatchLoader(new ExperimentReader(), 3).load(List.of(inconsistent, st, flowReactor, missing));

        Assertions.assertFalse(statuses.get(0).succeeded());
        Assertions.assertInstanceOf(InconsistentSeriesLengthException.class, statuses.get(0).failure());
        Assertions.assertTrue(statuses.get(0).simulations().isEmpty());

        Assertions.assertTrue(statuses.get(1).succeeded());
        Assertions.assertEquals(2, statuses.get(1).simulations().size());

        Assertions.assertInstanceOf(UnrecognizedExperimentKindException.class, statuses.get(2).failure());
        Assertions.assertInstanceOf(UncheckedIOException.class, statuses.get(3).failure());
        Assertions.assertEquals(2, DocumentStatus.simulationCount(statuses));
    }

    @Test
    void shouldNotRetryFailedDocuments() {
        Path file = Path.of("flaky.xml");
        ExperimentReader reader = Mockito.mock(ExperimentReader.class);
        Mockito.when(reader.readSimulations(file)).thenThrow(new UnrecognizedExperimentKindException("flow reactor"));

        List<DocumentStatus> statuses = new ExperimentBatchLoader(reader, 1).load(List.of(file));

        Assertions.assertEquals(1, statuses.size());
        Assertions.assertFalse(statuses.get(0).succeeded());
        Mockito.verify(reader, Mockito.times(1)).readSimulations(file);
    }

    @Test
    void shouldRecordUnexpectedFailureWithoutAbortingBatch() {
        Path broken = Path.of("broken.xml");
        Path good = Path.of("good.xml");
        ExperimentReader reader = Mockito.mock(ExperimentReader.class);
        IllegalStateException failure = new IllegalStateException("parser misconfigured");
        Mockito.when(reader.readSimulations(broken)).thenThrow(failure);
        Mockito.when(reader.readSimulations(good)).thenReturn(List.of());

        List<DocumentStatus> statuses = new ExperimentBatchLoader(reader, 2).load(List.of(broken, good));

        Assertions.assertEquals(2, statuses.size());
        Assertions.assertEquals(broken, statuses.get(0).file());
        Assertions.assertSame(failure, statuses.get(0).failure());
        Assertions.assertTrue(statuses.get(1).succeeded());
    }

    @Test
    void shouldRecordPathWithoutFileNameAsFailure(@TempDir Path testDir) throws IOException {
        Path st = copyFixture("testfile_st.xml", testDir);
        Path root = testDir.getRoot();

        List<DocumentStatus> statuses = new ExperimentBatchLoader(new ExperimentReader(), 2).load(List.of(root, st));

        Assertions.assertInstanceOf(IllegalArgumentException.class, statuses.get(0).failure());
        Assertions.assertTrue(statuses.get(1).succeeded());
    }

    @Test
    void shouldHandleEmptyBatch() {
        ExperimentReader reader = Mockito.mock(ExperimentReader.class);

        List<DocumentStatus> statuses = new ExperimentBatchLoader(reader, 4).load(List.of());

        Assertions.assertTrue(statuses.isEmpty());
        Mockito.verifyNoInteractions(reader);
    }

    @Test
    void shouldRejectInvalidWorkerCount() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ExperimentBatchLoader(new ExperimentReader(), 0));
    }
}
