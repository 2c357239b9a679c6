package com.kubepulse.core.config;

import com.kubepulse.core.model.BudgetRule;
import com.kubepulse.core.model.SliType;
import com.kubepulse.core.model.Slo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Describes a single SLO loaded from configuration.
 *
 * <p>
 * Supported indicators: {@code availability}, {@code latency},
 * {@code error_rate}; any other value is tracked as a generic average.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after deserialization to verify that all
 * required fields are present and valid, then {@link #toSlo()} to obtain the
 * immutable domain object.
 * </p>
 *
 * @since 1.0.0
 */
public class SloDefinition {

    /** Unique SLO name. */
    private String name;

    private String description = "";

    /** Indicator type, normalised to lowercase. */
    private String sli = "generic";

    /** Target in percent (or in the indicator's unit for latency/generic). */
    private double target;

    /** Evaluation window, e.g. {@code 720h} or {@code P30D}. */
    private String window = "720h";

    private List<BudgetRuleDefinition> budgetPolicy = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every invalid field
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("SLO 'name' is required");
        }
        if (!(target > 0)) {
            errors.add("SLO '" + name + "' requires 'target' > 0, got: " + target);
        } else if (isPercentage() && target > 100) {
            errors.add("SLO '" + name + "' requires 'target' <= 100 for sli '" + sli + "', got: " + target);
        }
        if (window != null) {
            try {
                if (Durations.parse(window).isNegative()) {
                    errors.add("SLO '" + name + "' requires a non-negative 'window'");
                }
            } catch (IllegalArgumentException e) {
                errors.add("SLO '" + name + "': " + e.getMessage());
            }
        }
        for (int i = 0; i < budgetPolicy.size(); i++) {
            BudgetRuleDefinition rule = budgetPolicy.get(i);
            if (rule == null) {
                errors.add("SLO '" + name + "' budget rule #" + i + " is null");
                continue;
            }
            if (rule.getThreshold() < 0 || rule.getThreshold() > 100) {
                errors.add("SLO '" + name + "' budget rule #" + i
                        + " requires 'threshold' in [0, 100], got: " + rule.getThreshold());
            }
            try {
                rule.toBudgetRule();
            } catch (IllegalArgumentException e) {
                errors.add("SLO '" + name + "' budget rule #" + i + ": " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid SloDefinition: " + String.join("; ", errors));
        }
    }

    private boolean isPercentage() {
        SliType type = SliType.fromWireName(sli);
        return type == SliType.AVAILABILITY || type == SliType.ERROR_RATE;
    }

    /**
     * @return the immutable SLO described by this definition
     * @throws IllegalArgumentException if the window or a budget action is invalid
     */
    public Slo toSlo() {
        List<BudgetRule> rules = budgetPolicy.stream()
                .map(BudgetRuleDefinition::toBudgetRule)
                .toList();
        return Slo.builder()
                .name(name)
                .description(description)
                .sli(sli)
                .target(target)
                .window(window != null ? Durations.parse(window) : null)
                .budgetPolicy(rules)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSli() {
        return sli;
    }

    /**
     * Set the indicator type, normalised to lowercase.
     *
     * @param sli indicator type
     */
    public void setSli(String sli) {
        this.sli = sli != null ? sli.toLowerCase(Locale.ROOT) : null;
    }

    public double getTarget() {
        return target;
    }

    public void setTarget(double target) {
        this.target = target;
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }

    /**
     * @return unmodifiable budget rules
     */
    public List<BudgetRuleDefinition> getBudgetPolicy() {
        return Collections.unmodifiableList(budgetPolicy);
    }

    public void setBudgetPolicy(List<BudgetRuleDefinition> budgetPolicy) {
        this.budgetPolicy = budgetPolicy != null ? new ArrayList<>(budgetPolicy) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SloDefinition{" +
                "name='" + name + '\'' +
                ", sli='" + sli + '\'' +
                ", target=" + target +
                ", window='" + window + '\'' +
                ", budgetPolicy=" + budgetPolicy +
                '}';
    }
}
