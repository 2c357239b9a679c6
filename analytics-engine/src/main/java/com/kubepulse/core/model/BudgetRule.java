package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One step of an SLO's error-budget policy: once {@code threshold} percent of
 * the budget has been consumed, {@code action} is requested.
 *
 * @since 1.0.0
 */
public final class BudgetRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double threshold;
    private final BudgetAction action;

    @JsonCreator
    public BudgetRule(@JsonProperty("threshold") double threshold,
            @JsonProperty("action") BudgetAction action) {
        this.threshold = threshold;
        this.action = Objects.requireNonNull(action, "Budget rule action must not be null");
    }

    /** Percentage of the error budget consumed at which the rule triggers. */
    public double getThreshold() {
        return threshold;
    }

    public BudgetAction getAction() {
        return action;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BudgetRule that))
            return false;
        return Double.compare(threshold, that.threshold) == 0 && action == that.action;
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, action);
    }

    @Override
    public String toString() {
        return "BudgetRule{threshold=" + threshold + ", action=" + action.wireName() + '}';
    }
}
