package com.kubepulse.core.detection;

import com.kubepulse.core.config.DetectorSettings;
import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Prediction;
import com.kubepulse.core.model.PredictionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Z-score anomaly detector over a rolling per-metric baseline.
 *
 * <p>
 * Each metric name gets a {@link Baseline} of its most recent values. A
 * value is anomalous when it lies more than {@code threshold} standard
 * deviations from the baseline mean. Anomalous values produce a
 * {@link PredictionStatus#DEGRADED} prediction stamped {@code horizon}
 * after detection time, with a probability of {@code min(z / 10, 1)}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Until a baseline has absorbed {@code warmupSamples} observations, values
 * are recorded but never reported.
 * </p>
 *
 * <h3>Adaptation</h3>
 * <p>
 * Every value, anomalous or not, is folded into its baseline before the
 * next comparison and before the probability is scored. A sustained shift is
 * therefore absorbed within a few samples and stops being reported.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The baseline map is guarded by a read/write lock: detection holds the
 * write lock for the whole batch, snapshots take the read lock.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalAnomalyDetector.class);

    public static final String ENGINE_NAME = "statistical";

    /** Divisor mapping a z-score onto the {@code [0, 1]} probability scale. */
    static final double PROBABILITY_SCALE = 10.0;

    private final double threshold;
    private final int warmupSamples;
    private final int windowCapacity;
    private final Duration horizon;
    private final Clock clock;

    private final Map<String, Baseline> baselines = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Detector with default settings and the system UTC clock.
     */
    public StatisticalAnomalyDetector() {
        this(DetectorSettings.defaults());
    }

    /**
     * @param settings detector settings; must not be {@code null}
     */
    public StatisticalAnomalyDetector(DetectorSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * @param settings detector settings; must not be {@code null}
     * @param clock    clock used to stamp predictions; must not be {@code null}
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if a setting is out of range
     */
    public StatisticalAnomalyDetector(DetectorSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.threshold = settings.getThreshold();
        this.warmupSamples = settings.getWarmupSamples();
        this.windowCapacity = settings.getWindowCapacity();
        this.horizon = settings.horizon();

        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (warmupSamples < 0) {
            throw new IllegalArgumentException("warmupSamples must be >= 0, got: " + warmupSamples);
        }
        if (windowCapacity < 2) {
            throw new IllegalArgumentException("windowCapacity must be >= 2, got: " + windowCapacity);
        }
        if (horizon.isNegative() || horizon.isZero()) {
            throw new IllegalArgumentException("predictionHorizon must be positive, got: " + horizon);
        }
    }

    @Override
    public List<Prediction> detectAnomalies(List<Metric> metrics) {
        Objects.requireNonNull(metrics, "Metrics list must not be null");

        List<Prediction> predictions = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (Metric metric : metrics) {
                Objects.requireNonNull(metric, "Metric must not be null");
                if (isAnomalous(metric)) {
                    predictions.add(Prediction.builder()
                            .timestamp(clock.instant().plus(horizon))
                            .status(PredictionStatus.DEGRADED)
                            .probability(calculateProbability(metric))
                            .reason(Prediction.STATISTICAL_ANOMALY)
                            .build());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return predictions;
    }

    @Override
    public Optional<BaselineSnapshot> baselineSnapshot(String metricName) {
        lock.readLock().lock();
        try {
            Baseline baseline = baselines.get(metricName);
            return baseline == null ? Optional.empty() : Optional.of(baseline.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> trackedMetrics() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(baselines.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String engineName() {
        return ENGINE_NAME;
    }

    public double getThreshold() {
        return threshold;
    }

    // ---------------------------------------------------------------
    // Detection helpers (caller holds the write lock)
    // ---------------------------------------------------------------

    private boolean isAnomalous(Metric metric) {
        Baseline baseline = baselines.computeIfAbsent(metric.getName(), name -> new Baseline(windowCapacity));
        double value = metric.getValue();

        if (baseline.count() < warmupSamples) {
            LOG.trace("Metric [{}]: warm-up {}/{}: recording only",
                    metric.getName(), baseline.count() + 1, warmupSamples);
            baseline.update(value);
            return false;
        }

        double zScore = baseline.zScore(value);
        boolean anomalous = zScore > threshold;
        if (anomalous) {
            LOG.debug("Metric [{}] anomalous: value={} mean={} stddev={} zscore={} threshold={}",
                    metric.getName(), value, baseline.mean(), baseline.stddev(), zScore, threshold);
        }

        baseline.update(value);
        return anomalous;
    }

    /** Scores against the baseline as it stands after the value was absorbed. */
    private double calculateProbability(Metric metric) {
        Baseline baseline = baselines.get(metric.getName());
        return probability(baseline.zScore(metric.getValue()));
    }

    /**
     * Linear, saturating map from z-score to a severity score in {@code [0, 1]}.
     */
    static double probability(double zScore) {
        return Math.min(zScore / PROBABILITY_SCALE, 1.0);
    }
}
