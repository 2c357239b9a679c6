package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Error-budget arithmetic shared by the tracker.
 *
 * <p>
 * The burn rate is a dimensionless heuristic (average per-sample decrease
 * over the most recent samples), and the time-to-exhaust estimate treats it
 * as "budget points per hour". Neither is a calibrated rate.
 * </p>
 */
final class ErrorBudget {

    /** Every point of deficit below target costs this many budget points. */
    static final double DEFICIT_PENALTY = 10.0;

    /** Number of most recent samples the burn rate looks at. */
    static final int BURN_RATE_SAMPLES = 10;

    /** Estimates at or beyond this many hours are not reported. */
    static final double MAX_EXHAUSTION_HOURS = 168.0;

    private static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private ErrorBudget() {
        // utility class
    }

    /**
     * @return 100 when {@code currentValue} meets {@code target}, otherwise
     *         {@code max(0, 100 - deficit * 10)}
     */
    static double remaining(double currentValue, double target) {
        if (currentValue < target) {
            double deficit = target - currentValue;
            return Math.max(0, 100.0 - deficit * DEFICIT_PENALTY);
        }
        return 100.0;
    }

    /**
     * Sum of successive decreases over the last {@value #BURN_RATE_SAMPLES}
     * samples divided by the number of steps between them. Flat or rising
     * series burn nothing; fewer than two samples burn nothing.
     *
     * <p>
     * With fewer than {@value #BURN_RATE_SAMPLES} samples the divisor is the
     * number of steps actually available ({@code n - 1}), not
     * {@code BURN_RATE_SAMPLES - 1}.
     * </p>
     */
    static double burnRate(List<Metric> history) {
        if (history.size() < 2) {
            return 0.0;
        }
        List<Metric> recent = history.subList(
                Math.max(0, history.size() - BURN_RATE_SAMPLES), history.size());

        double sum = 0;
        for (int i = 1; i < recent.size(); i++) {
            double previous = recent.get(i - 1).getValue();
            double current = recent.get(i).getValue();
            if (current < previous) {
                sum += previous - current;
            }
        }
        return sum / (recent.size() - 1);
    }

    /**
     * @return {@code errorBudget / burnRate} hours when the burn rate is
     *         positive and the estimate is under one week, otherwise empty
     */
    static Optional<Duration> timeToExhaust(double errorBudget, double burnRate) {
        if (burnRate <= 0) {
            return Optional.empty();
        }
        double hoursLeft = errorBudget / burnRate;
        if (hoursLeft >= MAX_EXHAUSTION_HOURS) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos((long) (hoursLeft * NANOS_PER_HOUR)));
    }
}
