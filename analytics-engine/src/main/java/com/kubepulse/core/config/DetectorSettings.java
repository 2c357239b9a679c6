package com.kubepulse.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tuning parameters of the anomaly detector, bound from the {@code detector}
 * section of the analytics YAML.
 *
 * <p>
 * Defaults: a z-score threshold of
 * {@value #DEFAULT_THRESHOLD}, {@value #DEFAULT_WARMUP_SAMPLES} warm-up
 * samples, a rolling window of {@value #DEFAULT_WINDOW_CAPACITY} values and
 * a one-hour forecast horizon.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings {

    public static final String DEFAULT_ENGINE = "statistical";
    public static final double DEFAULT_THRESHOLD = 2.0;
    public static final int DEFAULT_WARMUP_SAMPLES = 10;
    public static final int DEFAULT_WINDOW_CAPACITY = 100;
    public static final String DEFAULT_PREDICTION_HORIZON = "1h";

    private boolean enabled = true;

    /** Detector engine; only "statistical" ships. */
    private String engine = DEFAULT_ENGINE;

    /** Number of standard deviations beyond which a value is anomalous. */
    private double threshold = DEFAULT_THRESHOLD;

    /** Observations absorbed per metric before verdicts are issued. */
    private int warmupSamples = DEFAULT_WARMUP_SAMPLES;

    /** Size of each metric's rolling baseline window. */
    private int windowCapacity = DEFAULT_WINDOW_CAPACITY;

    /** How far ahead of detection time a prediction is stamped. */
    private String predictionHorizon = DEFAULT_PREDICTION_HORIZON;

    /**
     * @return settings with every field at its default
     */
    public static DetectorSettings defaults() {
        return new DetectorSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (engine == null || engine.isBlank()) {
            errors.add("Detector 'engine' is required");
        }
        if (!(threshold > 0)) {
            errors.add("Detector 'threshold' must be > 0, got: " + threshold);
        }
        if (warmupSamples < 0) {
            errors.add("Detector 'warmupSamples' must be >= 0, got: " + warmupSamples);
        }
        if (windowCapacity < 2) {
            errors.add("Detector 'windowCapacity' must be >= 2, got: " + windowCapacity);
        }
        if (predictionHorizon == null) {
            errors.add("Detector 'predictionHorizon' is required");
        } else {
            try {
                Duration horizon = Durations.parse(predictionHorizon);
                if (horizon.isNegative() || horizon.isZero()) {
                    errors.add("Detector 'predictionHorizon' must be positive, got: " + predictionHorizon);
                }
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed forecast horizon
     * @throws IllegalArgumentException if the configured text is not a duration
     */
    public Duration horizon() {
        return Durations.parse(predictionHorizon);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEngine() {
        return engine;
    }

    /**
     * Set the engine name, normalised to lowercase.
     *
     * @param engine engine name
     */
    public void setEngine(String engine) {
        this.engine = engine != null ? engine.toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWarmupSamples() {
        return warmupSamples;
    }

    public void setWarmupSamples(int warmupSamples) {
        this.warmupSamples = warmupSamples;
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public void setWindowCapacity(int windowCapacity) {
        this.windowCapacity = windowCapacity;
    }

    public String getPredictionHorizon() {
        return predictionHorizon;
    }

    public void setPredictionHorizon(String predictionHorizon) {
        this.predictionHorizon = predictionHorizon;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "enabled=" + enabled +
                ", engine='" + engine + '\'' +
                ", threshold=" + threshold +
                ", warmupSamples=" + warmupSamples +
                ", windowCapacity=" + windowCapacity +
                ", predictionHorizon='" + predictionHorizon + '\'' +
                '}';
    }
}
