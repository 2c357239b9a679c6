package com.kubepulse.core.slo;

import com.kubepulse.core.model.BudgetAction;
import com.kubepulse.core.model.BudgetRule;
import com.kubepulse.core.model.SloStatus;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves which of an SLO's budget-policy rules apply to a status.
 *
 * <p>
 * A rule is triggered once the consumed share of the error budget,
 * {@code 100 - errorBudget}, reaches its threshold.
 * </p>
 *
 * @since 1.0.0
 */
public final class BudgetPolicyEvaluator {

    private BudgetPolicyEvaluator() {
        // utility class
    }

    /**
     * @param status SLO status; must not be {@code null}
     * @return triggered rules in declaration order (unmodifiable)
     * @throws NullPointerException if {@code status} or its SLO is {@code null}
     */
    public static List<BudgetRule> triggered(SloStatus status) {
        Objects.requireNonNull(status, "SloStatus must not be null");
        Objects.requireNonNull(status.getSlo(), "SloStatus has no SLO");

        double consumed = consumed(status);
        return status.getSlo().getBudgetPolicy().stream()
                .filter(rule -> consumed >= rule.getThreshold())
                .toList();
    }

    /**
     * @param status SLO status; must not be {@code null}
     * @return the most severe triggered action, if any
     */
    public static Optional<BudgetAction> highestAction(SloStatus status) {
        return triggered(status).stream()
                .map(BudgetRule::getAction)
                .max(Comparator.naturalOrder());
    }

    /**
     * @return percentage of the error budget already consumed
     */
    public static double consumed(SloStatus status) {
        return 100.0 - status.getErrorBudget();
    }
}
