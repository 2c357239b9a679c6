package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single numeric health sample, e.g. CPU percent or request latency.
 *
 * <p>
 * Metrics are produced by an external health-check scheduler and handed to
 * the analytics engines, which copy the values they need into their own
 * state. Instances are immutable.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #of(String, double)} for quick samples or the {@link Builder}
 * when a unit, labels or an explicit timestamp are needed. A missing
 * timestamp defaults to {@link Instant#now()} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Metric implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double value;
    private final String unit;
    private final Map<String, String> labels;
    private final Instant timestamp;

    @JsonCreator
    Metric(@JsonProperty("name") String name,
            @JsonProperty("value") double value,
            @JsonProperty("unit") String unit,
            @JsonProperty("labels") Map<String, String> labels,
            @JsonProperty("timestamp") Instant timestamp) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.value = value;
        this.unit = unit != null ? unit : "";
        this.labels = labels != null && !labels.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(labels))
                : Collections.emptyMap();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /**
     * Shorthand for a unit-less, label-less sample taken now.
     *
     * @param name  metric name; must not be {@code null}
     * @param value sample value
     * @return a new metric
     */
    public static Metric of(String name, double value) {
        return builder().name(name).value(value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Metric}. {@code name} is required.
     */
    public static class Builder {
        private String name;
        private double value;
        private String unit;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private Instant timestamp;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder label(String key, String value) {
            this.labels.put(Objects.requireNonNull(key, "Label key must not be null"), value);
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels.clear();
            if (labels != null) {
                this.labels.putAll(labels);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * @return a new {@link Metric}
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public Metric build() {
            return new Metric(name, value, unit, labels, timestamp);
        }
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    /**
     * @return unmodifiable label map, empty when the producer set none
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Metric that))
            return false;
        return Double.compare(value, that.value) == 0
                && name.equals(that.name)
                && unit.equals(that.unit)
                && labels.equals(that.labels)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, unit, labels, timestamp);
    }

    @Override
    public String toString() {
        return "Metric{" +
                "name='" + name + '\'' +
                ", value=" + value +
                (unit.isEmpty() ? "" : ", unit='" + unit + '\'') +
                (labels.isEmpty() ? "" : ", labels=" + labels) +
                ", timestamp=" + timestamp +
                '}';
    }
}
