package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

class ConfigLoaderTest {

    private final ConfigLoader configLoader = new ConfigLoader();

    @Test
    void shouldLoadConfig(@TempDir File testDir) throws IOException {
        Path configPath = Path.of(testDir.getAbsolutePath(), "config.json");
        Files.writeString(configPath, """
            {
              "worker_threads": 8,
              "column_aliases": {"ignition delay time": "ignition delay", "T5": "temperature"},
              "unused_setting": true
            }
            """);

        ParserConfig config = configLoader.load(configPath.toFile());

        Assertions.assertEquals(8, config.getWorker_threads());
        Assertions.assertEquals(Map.of("ignition delay time", "ignition delay", "T5", "temperature"), config.getColumn_aliases());
    }

    @Test
    void shouldUseDefaultsWhenFileIsMissing(@TempDir File testDir) {
        ParserConfig config = configLoader.load(new File(testDir, "config.json"));

        Assertions.assertEquals(ParserConfig.DEFAULT_WORKER_THREADS, config.getWorker_threads());
        Assertions.assertTrue(config.getColumn_aliases().isEmpty());
    }

    @Test
    void shouldRejectAliasToUnknownSeries(@TempDir File testDir) throws IOException {
        Path configPath = Path.of(testDir.getAbsolutePath(), "config.json");
        Files.writeString(configPath, """
            {"column_aliases": {"phi": "equivalence ratio"}}
            """);

        IllegalArgumentException exception =
            Assertions.assertThrows(IllegalArgumentException.class, () -> configLoader.load(configPath.toFile()));
        Assertions.assertTrue(exception.getMessage().contains("equivalence ratio"));
    }

    @Test
    void shouldRejectNonPositiveWorkerThreads(@TempDir File testDir) throws IOException {
        Path configPath = Path.of(testDir.getAbsolutePath(), "config.json");
        Files.writeString(configPath, "{\"worker_threads\": 0}");

        Assertions.assertThrows(IllegalArgumentException.class, () -> configLoader.load(configPath.toFile()));
    }

    @Test
    void shouldFailOnMalformedJson(@TempDir File testDir) throws IOException {
        Path configPath = Path.of(testDir.getAbsolutePath(), "config.json");
        Files.writeString(configPath, "{\"worker_threads\": ");

        Assertions.assertThrows(UncheckedIOException.class, () -> configLoader.load(configPath.toFile()));
    }
}
