package com.kubepulse.core.config;

import com.kubepulse.core.model.BudgetAction;
import com.kubepulse.core.model.BudgetRule;

/**
 * YAML binding for one budget-policy step of an {@link SloDefinition}.
 *
 * @since 1.0.0
 */
public class BudgetRuleDefinition {

    /** Percentage of the error budget consumed, in {@code [0, 100]}. */
    private double threshold;

    /** One of notify, alert, page. */
    private String action;

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    /**
     * @return the domain rule
     * @throws IllegalArgumentException if the action is unknown
     */
    public BudgetRule toBudgetRule() {
        return new BudgetRule(threshold, BudgetAction.fromWireName(action));
    }

    @Override
    public String toString() {
        return "BudgetRuleDefinition{threshold=" + threshold + ", action='" + action + "'}";
    }
}
