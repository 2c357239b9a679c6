package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Forecast emitted when a metric deviates from its learned baseline.
 *
 * <p>
 * The {@code timestamp} is the forecast horizon (detection time plus the
 * configured horizon), not the time the deviation was observed.
 * {@code probability} is a severity score in {@code [0, 1]}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp} and {@code status} are
 * required; omitting either throws {@link NullPointerException} at build
 * time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Prediction implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Default reason attached by the statistical detector. */
    public static final String STATISTICAL_ANOMALY = "Statistical anomaly detected";

    private Instant timestamp;
    private PredictionStatus status;
    private double probability;
    private String reason;

    /** No-arg constructor required by Jackson. */
    public Prediction() {
    }

    private Prediction(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.probability = builder.probability;
        this.reason = builder.reason;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Prediction} instances.
     */
    public static class Builder {
        private Instant timestamp;
        private PredictionStatus status;
        private double probability;
        private String reason;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder status(PredictionStatus status) {
            this.status = status;
            return this;
        }

        public Builder probability(double probability) {
            this.probability = probability;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        /**
         * @return a new {@link Prediction}
         * @throws NullPointerException if {@code timestamp} or {@code status} is
         *                              {@code null}
         */
        public Prediction build() {
            return new Prediction(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public PredictionStatus getStatus() {
        return status;
    }

    public void setStatus(PredictionStatus status) {
        this.status = status;
    }

    public double getProbability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Prediction that))
            return false;
        return Double.compare(probability, that.probability) == 0
                && Objects.equals(timestamp, that.timestamp)
                && status == that.status
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, status, probability, reason);
    }

    @Override
    public String toString() {
        return "Prediction{" +
                "timestamp=" + timestamp +
                ", status=" + status +
                ", probability=" + probability +
                ", reason='" + reason + '\'' +
                '}';
    }
}
