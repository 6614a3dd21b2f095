package edu.harvard.hms.dbmi.avillach.kinetics.etl.experiment.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Settings for loading experiment documents. The names are using snake_case to match the JSON keys in the config file.
 */
public class ParserConfig {

    public static final int DEFAULT_WORKER_THREADS = 4;

    private int worker_threads = DEFAULT_WORKER_THREADS;
    // data group column name -> one of the known series names, e.g. "ignition delay time" -> "ignition delay"
    private Map<String, String> column_aliases = new HashMap<>();

    public int getWorker_threads() {
        return worker_threads;
    }

    public void setWorker_threads(int worker_threads) {
        this.worker_threads = worker_threads;
    }

    public Map<String, String> getColumn_aliases() {
        return column_aliases;
    }

    public void setColumn_aliases(Map<String, String> column_aliases) {
        this.column_aliases = column_aliases == null ? new HashMap<>() : column_aliases;
    }

    @Override
    public String toString() {
        return "ParserConfig{worker_threads=" + worker_threads + ", column_aliases=" + column_aliases + "}";
    }
}
