package com.kubepulse.core;

import com.kubepulse.core.config.AnalyticsConfig;
import com.kubepulse.core.config.AnalyticsConfigLoader;
import com.kubepulse.core.config.SloDefinition;
import com.kubepulse.core.detection.AnomalyDetector;
import com.kubepulse.core.detection.DetectorFactory;
import com.kubepulse.core.model.BudgetRule;
import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Prediction;
import com.kubepulse.core.model.Slo;
import com.kubepulse.core.model.SloStatus;
import com.kubepulse.core.slo.BudgetPolicyEvaluator;
import com.kubepulse.core.slo.SloTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point that wires the anomaly detector and the SLO tracker from one
 * {@link AnalyticsConfig}.
 *
 * <p>
 * The two engines share nothing but the {@link Metric} shape: anomaly
 * detection and SLO accounting can be fed from different threads and
 * their outputs are combined by whoever serializes them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromConfig(AnalyticsConfig)} or {@link #load()} (which resolves
 * the configuration through {@link AnalyticsConfigLoader#load()}).
 * </p>
 *
 * @since 1.0.0
 */
public final class HealthAnalytics {

    private static final Logger LOG = LoggerFactory.getLogger(HealthAnalytics.class);

    private final AnomalyDetector detector;
    private final SloTracker tracker;
    private final boolean detectionEnabled;

    HealthAnalytics(AnomalyDetector detector, SloTracker tracker, boolean detectionEnabled) {
        this.detector = Objects.requireNonNull(detector, "AnomalyDetector must not be null");
        this.tracker = Objects.requireNonNull(tracker, "SloTracker must not be null");
        this.detectionEnabled = detectionEnabled;
    }

    /**
     * Build from the configuration found by {@link AnalyticsConfigLoader#load()}.
     *
     * @return a ready analytics instance
     * @throws IllegalStateException if the configuration is invalid
     */
    public static HealthAnalytics load() {
        return fromConfig(AnalyticsConfigLoader.load());
    }

    /**
     * @param config validated configuration; must not be {@code null}
     * @return a ready analytics instance with every configured SLO registered
     */
    public static HealthAnalytics fromConfig(AnalyticsConfig config) {
        return fromConfig(config, Clock.systemUTC());
    }

    /**
     * @param config validated configuration; must not be {@code null}
     * @param clock  clock used to stamp predictions; must not be {@code null}
     * @return a ready analytics instance with every configured SLO registered
     */
    public static HealthAnalytics fromConfig(AnalyticsConfig config, Clock clock) {
        Objects.requireNonNull(config, "AnalyticsConfig must not be null");

        AnomalyDetector detector = DetectorFactory.create(config.getDetector(), clock);
        SloTracker tracker = new SloTracker();
        for (SloDefinition definition : config.getSlos()) {
            tracker.addSlo(definition.toSlo());
        }

        boolean enabled = config.getDetector().isEnabled();
        if (!enabled) {
            LOG.info("Anomaly detection disabled by configuration");
        }
        LOG.info("Health analytics ready: engine={} slos={}",
                detector.engineName(), config.getSlos().size());
        return new HealthAnalytics(detector, tracker, enabled);
    }

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------

    /**
     * @param metrics samples to evaluate; must not be {@code null}
     * @return predictions for anomalous samples, or an empty list when
     *         detection is disabled
     */
    public List<Prediction> detectAnomalies(List<Metric> metrics) {
        Objects.requireNonNull(metrics, "Metrics list must not be null");
        if (!detectionEnabled) {
            return Collections.emptyList();
        }
        List<Prediction> predictions = detector.detectAnomalies(metrics);
        if (!predictions.isEmpty()) {
            LOG.info("{} anomalous metric(s) out of {}", predictions.size(), metrics.size());
        }
        return predictions;
    }

    public boolean isDetectionEnabled() {
        return detectionEnabled;
    }

    public AnomalyDetector detector() {
        return detector;
    }

    // ---------------------------------------------------------------
    // SLO tracking
    // ---------------------------------------------------------------

    public void addSlo(Slo slo) {
        tracker.addSlo(slo);
    }

    /**
     * Feed samples to one SLO. Unknown names are ignored.
     */
    public void recordSloMetrics(String sloName, List<Metric> metrics) {
        tracker.updateMetrics(sloName, metrics);
    }

    public Optional<SloStatus> sloStatus(String sloName) {
        return tracker.getSloStatus(sloName);
    }

    public Map<String, SloStatus> allSloStatuses() {
        return tracker.getAllSlos();
    }

    /**
     * @param sloName SLO name
     * @return budget rules currently triggered for the SLO; empty when the
     *         SLO is unknown or nothing is triggered
     */
    public List<BudgetRule> triggeredBudgetRules(String sloName) {
        return tracker.getSloStatus(sloName)
                .map(BudgetPolicyEvaluator::triggered)
                .orElse(Collections.emptyList());
    }

    public SloTracker tracker() {
        return tracker;
    }
}
