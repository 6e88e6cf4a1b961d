package com.example.verification.config;

import com.example.verification.checkpoint.CheckpointStore;
import com.example.verification.checkpoint.FileCheckpointStore;
import com.example.verification.exception.ConfigurationException;
import com.example.verification.model.CompletenessPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Run-level settings of the engine, read from environment variables with defaults.
 *
 * <p>Per-variable statistics configuration (thresholds, bins) is not here; it
 * is passed explicitly to {@link com.example.verification.aggregation.AccumulatorFactory}.
 */
public class EngineSettings {

    // ── Checkpointing ─────────────────────────────────────────────────────────
    public final Path checkpointDir;
    public final String checkpointName;
    public final int checkpointEvery;

    // ── Parallelism ───────────────────────────────────────────────────────────
    public final int workers;

    // ── Completeness ──────────────────────────────────────────────────────────
    public final int gridpointMinSamples;
    public final int regionMinSamples;
    public final int stationMinSamples;

    public EngineSettings(Map<String, String> values) {
        this.checkpointDir = Path.of(get(values, "VERIFY_CHECKPOINT_DIR", "checkpoints"));
        this.checkpointName = get(values, "VERIFY_CHECKPOINT_NAME", "verification");
        this.checkpointEvery = positiveInt(values, "VERIFY_CHECKPOINT_EVERY", "50");
        this.workers = positiveInt(values, "VERIFY_WORKERS",
                Integer.toString(Runtime.getRuntime().availableProcessors()));
        this.gridpointMinSamples = positiveInt(values, "VERIFY_MIN_SAMPLES_GRIDPOINT",
                Long.toString(CompletenessPolicy.DEFAULT_GRIDPOINT_MIN_SAMPLES));
        this.regionMinSamples = positiveInt(values, "VERIFY_MIN_SAMPLES_REGION",
                Long.toString(CompletenessPolicy.DEFAULT_REGION_MIN_SAMPLES));
        this.stationMinSamples = positiveInt(values, "VERIFY_MIN_SAMPLES_STATION",
                Long.toString(CompletenessPolicy.DEFAULT_STATION_MIN_SAMPLES));
        if (checkpointName.isBlank()) {
            throw new ConfigurationException("VERIFY_CHECKPOINT_NAME must not be blank");
        }
    }

    public static EngineSettings fromEnvironment() {
        return new EngineSettings(System.getenv());
    }

    /**
     * Opens the named file checkpoint under {@link #checkpointDir}, creating the directory if needed.
     */
    public CheckpointStore openCheckpointStore() throws IOException {
        return new FileCheckpointStore(checkpointDir, checkpointName);
    }

    public CompletenessPolicy completenessPolicy() {
        return new CompletenessPolicy(gridpointMinSamples, regionMinSamples, stationMinSamples);
    }

    private static int positiveInt(Map<String, String> values, String key, String defaultValue) {
        String raw = get(values, key, defaultValue);
        int parsed;
        try {
            parsed = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + raw + "'", e);
        }
        if (parsed < 1) {
            throw new ConfigurationException(key + " must be >= 1, got " + parsed);
        }
        return parsed;
    }

    private static String get(Map<String, String> values, String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }
}
