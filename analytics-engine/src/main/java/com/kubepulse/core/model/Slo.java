package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A declared Service Level Objective.
 *
 * <p>
 * Immutable once built. The {@code name} is the unique key inside an
 * {@link com.kubepulse.core.slo.SloTracker}; registering another SLO with
 * the same name replaces this one.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Slo implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final String description;
    private final SliType sli;
    private final double target;
    private final Duration window;
    private final List<BudgetRule> budgetPolicy;

    @JsonCreator
    Slo(@JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("sli") SliType sli,
            @JsonProperty("target") double target,
            @JsonProperty("window") Duration window,
            @JsonProperty("budgetPolicy") List<BudgetRule> budgetPolicy) {
        this.name = Objects.requireNonNull(name, "SLO name must not be null");
        this.description = description != null ? description : "";
        this.sli = sli != null ? sli : SliType.GENERIC;
        this.target = target;
        this.window = window != null ? window : Duration.ZERO;
        this.budgetPolicy = budgetPolicy != null
                ? Collections.unmodifiableList(new ArrayList<>(budgetPolicy))
                : Collections.emptyList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Slo}. Only {@code name} is required; the SLI
     * defaults to {@link SliType#GENERIC}.
     */
    public static class Builder {
        private String name;
        private String description;
        private SliType sli;
        private double target;
        private Duration window;
        private final List<BudgetRule> budgetPolicy = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sli(SliType sli) {
            this.sli = sli;
            return this;
        }

        /** Resolves the indicator by wire name; unknown names become {@code generic}. */
        public Builder sli(String sli) {
            this.sli = SliType.fromWireName(sli);
            return this;
        }

        public Builder target(double target) {
            this.target = target;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder budgetRule(double threshold, BudgetAction action) {
            this.budgetPolicy.add(new BudgetRule(threshold, action));
            return this;
        }

        public Builder budgetPolicy(List<BudgetRule> rules) {
            this.budgetPolicy.clear();
            if (rules != null) {
                this.budgetPolicy.addAll(rules);
            }
            return this;
        }

        /**
         * @return a new {@link Slo}
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public Slo build() {
            return new Slo(name, description, sli, target, window, budgetPolicy);
        }
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public SliType getSli() {
        return sli;
    }

    /** Target value, in percent for the percentage-based indicators. */
    public double getTarget() {
        return target;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * @return unmodifiable budget rules in declaration order
     */
    public List<BudgetRule> getBudgetPolicy() {
        return budgetPolicy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Slo that))
            return false;
        return Double.compare(target, that.target) == 0
                && name.equals(that.name)
                && description.equals(that.description)
                && sli == that.sli
                && window.equals(that.window)
                && budgetPolicy.equals(that.budgetPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, sli, target, window, budgetPolicy);
    }

    @Override
    public String toString() {
        return "Slo{" +
                "name='" + name + '\'' +
                ", sli=" + sli.wireName() +
                ", target=" + target +
                ", window=" + window +
                ", budgetPolicy=" + budgetPolicy +
                '}';
    }
}
