package com.kubepulse.core.slo;

import com.kubepulse.core.model.BudgetAction;
import com.kubepulse.core.model.BudgetRule;
import com.kubepulse.core.model.SliType;
import com.kubepulse.core.model.Slo;
import com.kubepulse.core.model.SloStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BudgetPolicyEvaluator}.
 */
class BudgetPolicyEvaluatorTest {

    private static final Slo SLO = Slo.builder()
            .name("api")
            .sli(SliType.AVAILABILITY)
            .target(99.9)
            .budgetRule(50, BudgetAction.NOTIFY)
            .budgetRule(75, BudgetAction.ALERT)
            .budgetRule(90, BudgetAction.PAGE)
            .build();

    @Test
    @DisplayName("Should trigger nothing while the budget is untouched")
    void shouldTriggerNothingWithFullBudget() {
        SloStatus status = SloStatus.initial(SLO);

        assertThat(BudgetPolicyEvaluator.consumed(status)).isZero();
        assertThat(BudgetPolicyEvaluator.triggered(status)).isEmpty();
        assertThat(BudgetPolicyEvaluator.highestAction(status)).isEmpty();
    }

    @Test
    @DisplayName("Should trigger every rule whose threshold the consumed budget reached")
    void shouldTriggerReachedRules() {
        SloStatus status = withBudget(20);

        assertThat(BudgetPolicyEvaluator.triggered(status)).containsExactly(
                new BudgetRule(50, BudgetAction.NOTIFY),
                new BudgetRule(75, BudgetAction.ALERT));
        assertThat(BudgetPolicyEvaluator.highestAction(status)).contains(BudgetAction.ALERT);
    }

    @Test
    @DisplayName("Should treat the threshold as inclusive")
    void shouldIncludeThreshold() {
        assertThat(BudgetPolicyEvaluator.triggered(withBudget(50)))
                .extracting(BudgetRule::getAction)
                .containsExactly(BudgetAction.NOTIFY);
    }

    @Test
    @DisplayName("Should escalate to page once the budget is exhausted")
    void shouldPageWhenExhausted() {
        assertThat(BudgetPolicyEvaluator.triggered(withBudget(0))).hasSize(3);
        assertThat(BudgetPolicyEvaluator.highestAction(withBudget(0))).contains(BudgetAction.PAGE);
    }

    @Test
    @DisplayName("Should trigger nothing for an SLO without a budget policy")
    void shouldHandleEmptyPolicy() {
        SloStatus status = SloStatus.initial(Slo.builder().name("bare").target(1).build());
        status.setErrorBudget(0);

        assertThat(BudgetPolicyEvaluator.triggered(status)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a status without an SLO")
    void shouldRejectDetachedStatus() {
        assertThatThrownBy(() -> BudgetPolicyEvaluator.triggered(new SloStatus()))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("no SLO");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static SloStatus withBudget(double errorBudget) {
        SloStatus status = SloStatus.initial(SLO);
        status.setErrorBudget(errorBudget);
        return status;
    }
}
