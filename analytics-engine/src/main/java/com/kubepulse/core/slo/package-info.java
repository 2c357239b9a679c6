/**
 * SLO compliance and error-budget tracking.
 *
 * <p>
 * {@link com.kubepulse.core.slo.SloTracker} holds the declared SLOs and
 * recomputes their status on every metric update, using the
 * {@link com.kubepulse.core.slo.SliCalculator} matching each SLO's indicator.
 * {@link com.kubepulse.core.slo.BudgetPolicyEvaluator} maps a status onto the
 * SLO's budget-policy actions.
 * </p>
 *
 * @since 1.0.0
 */
package com.kubepulse.core.slo;
