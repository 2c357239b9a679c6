/**
 * Domain model shared by the anomaly detector, the SLO tracker and the wire
 * format.
 *
 * <ul>
 * <li>{@link com.kubepulse.core.model.Metric}: numeric health sample</li>
 * <li>{@link com.kubepulse.core.model.Prediction}: forecast emitted for an
 * anomalous sample</li>
 * <li>{@link com.kubepulse.core.model.Slo}: declared objective with its
 * budget policy</li>
 * <li>{@link com.kubepulse.core.model.SloStatus}: compliance snapshot of one
 * SLO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kubepulse.core.model;
