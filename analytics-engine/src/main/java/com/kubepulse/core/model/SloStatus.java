package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Compliance snapshot for one {@link Slo}.
 *
 * <p>
 * The tracker keeps one mutable instance per SLO and hands out copies
 * ({@link #copy()}) so callers never observe a status while it is being
 * recomputed.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The instances owned by
 * {@link com.kubepulse.core.slo.SloTracker} are only touched under its lock.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SloStatus implements Serializable {

    private static final long serialVersionUID = 1L;

    private Slo slo;
    private double currentValue;
    private double errorBudget;
    private double burnRate;
    private boolean violated;
    private String timeToExhaust;

    /** No-arg constructor required by Jackson. */
    public SloStatus() {
    }

    /**
     * Neutral status for a freshly registered SLO: value and budget at 100,
     * no burn, not violated.
     *
     * @param slo the SLO; must not be {@code null}
     * @return a new status
     */
    public static SloStatus initial(Slo slo) {
        SloStatus status = new SloStatus();
        status.slo = Objects.requireNonNull(slo, "SLO must not be null");
        status.currentValue = 100.0;
        status.errorBudget = 100.0;
        status.burnRate = 0.0;
        status.violated = false;
        return status;
    }

    /**
     * @return an independent copy of this status
     */
    public SloStatus copy() {
        SloStatus copy = new SloStatus();
        copy.slo = slo;
        copy.currentValue = currentValue;
        copy.errorBudget = errorBudget;
        copy.burnRate = burnRate;
        copy.violated = violated;
        copy.timeToExhaust = timeToExhaust;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public Slo getSlo() {
        return slo;
    }

    public void setSlo(Slo slo) {
        this.slo = slo;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(double currentValue) {
        this.currentValue = currentValue;
    }

    /** Remaining error budget in percent, {@code [0, 100]}. */
    public double getErrorBudget() {
        return errorBudget;
    }

    public void setErrorBudget(double errorBudget) {
        this.errorBudget = errorBudget;
    }

    public double getBurnRate() {
        return burnRate;
    }

    public void setBurnRate(double burnRate) {
        this.burnRate = burnRate;
    }

    @JsonProperty("isViolated")
    public boolean isViolated() {
        return violated;
    }

    @JsonProperty("isViolated")
    public void setViolated(boolean violated) {
        this.violated = violated;
    }

    /**
     * @return ISO-8601 duration until the budget is exhausted, or
     *         {@code null} when no estimate is available
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getTimeToExhaust() {
        return timeToExhaust;
    }

    public void setTimeToExhaust(String timeToExhaust) {
        this.timeToExhaust = timeToExhaust;
    }

    /**
     * @return the time-to-exhaust estimate, if one was recorded
     */
    public Optional<String> timeToExhaust() {
        return Optional.ofNullable(timeToExhaust);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SloStatus that))
            return false;
        return Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(errorBudget, that.errorBudget) == 0
                && Double.compare(burnRate, that.burnRate) == 0
                && violated == that.violated
                && Objects.equals(slo, that.slo)
                && Objects.equals(timeToExhaust, that.timeToExhaust);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slo, currentValue, errorBudget, burnRate, violated, timeToExhaust);
    }

    @Override
    public String toString() {
        return "SloStatus{" +
                "slo=" + (slo != null ? slo.getName() : null) +
                ", currentValue=" + currentValue +
                ", errorBudget=" + errorBudget +
                ", burnRate=" + burnRate +
                ", isViolated=" + violated +
                ", timeToExhaust=" + timeToExhaust +
                '}';
    }
}
