/**
 * Anomaly detection over per-metric rolling baselines.
 *
 * <p>
 * Engines implement {@link com.kubepulse.core.detection.AnomalyDetector} and
 * are instantiated via {@link com.kubepulse.core.detection.DetectorFactory}.
 * The built-in {@link com.kubepulse.core.detection.StatisticalAnomalyDetector}
 * flags values more than {@code threshold} standard deviations from the
 * mean of the metric's last {@code windowCapacity} values.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an engine, implement {@code AnomalyDetector} and register its name
 * in {@code DetectorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.kubepulse.core.detection;
