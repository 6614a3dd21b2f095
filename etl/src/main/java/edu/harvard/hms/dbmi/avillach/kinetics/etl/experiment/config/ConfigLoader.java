package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Loads the parser configuration from a JSON file. A missing file is not an error, the defaults are used instead.
     *
     * @param configFile path to the JSON config
     * @return the validated configuration
     * @throws UncheckedIOException     if the file exists but cannot be read or parsed
     * @throws IllegalArgumentException if the file contains invalid settings
     */
    public ParserConfig load(@Nonnull File configFile) {
        if (!configFile.exists()) {
            log.warn("ConfigLoader: config file does not exist: {}, using default settings", configFile.getAbsolutePath());
            return new ParserConfig();
        }

        ParserConfig config;
        try {
            config = objectMapper.readValue(configFile, ParserConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read parser config " + configFile.getAbsolutePath(), e);
        }
        validate(config);
        log.info("Loaded config from {}: {}", configFile.getAbsolutePath(), config);
        return config;
    }

    static void validate(ParserConfig config) {
        if (config.getWorker_threads() < 1) {
            throw new IllegalArgumentException("worker_threads must be at least 1, got " + config.getWorker_threads());
        }
        for (Map.Entry<String, String> alias : config.getColumn_aliases().entrySet()) {
            if (SeriesKey.fromColumnName(alias.getValue()).isEmpty()) {
                throw new IllegalArgumentException(
                    "Column alias " + alias.getKey() + " points at unknown series \"" + alias.getValue() + "\""
                );
            }
        }
    }
}
