package com.kubepulse.core.detection;

import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Prediction;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Contract for anomaly detection engines.
 * <p>
 * Implementations are <strong>stateful</strong>: they learn a baseline per
 * metric name across consecutive calls to {@link #detectAnomalies(List)}.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate each metric, in order, against its name's baseline.
     *
     * @param metrics incoming samples; must not be {@code null}
     * @return one prediction per anomalous metric, in input order; empty when
     *         nothing deviates
     */
    List<Prediction> detectAnomalies(List<Metric> metrics);

    /**
     * @param metricName metric name
     * @return the current baseline, or empty if the name was never observed
     */
    Optional<BaselineSnapshot> baselineSnapshot(String metricName);

    /**
     * @return names of all metrics that have a baseline
     */
    Set<String> trackedMetrics();

    /**
     * @return engine name as used in configuration
     */
    String engineName();
}
