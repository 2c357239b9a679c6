package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.SliType;

import java.util.List;

/**
 * Derives an SLO's current indicator value from its retained samples.
 *
 * <p>
 * Calculators are stateless; the tracker passes the SLO's full retained
 * history, oldest first, on every recompute. An empty or irrelevant history
 * yields a neutral default rather than an error.
 * </p>
 */
public interface SliCalculator {

    /** Counter of all requests. */
    String REQUEST_TOTAL = "request_total";

    /** Counter of successful requests. */
    String REQUEST_SUCCESS = "request_success";

    /** Counter of failed requests. */
    String REQUEST_ERRORS = "request_errors";

    /** Individual request latency samples. */
    String REQUEST_DURATION = "request_duration";

    /**
     * @param history retained samples in arrival order; never {@code null}
     * @return the indicator value
     */
    double calculate(List<Metric> history);

    /**
     * @param type indicator type; must not be {@code null}
     * @return the calculator for that indicator
     */
    static SliCalculator forType(SliType type) {
        return switch (type) {
            case AVAILABILITY -> AvailabilityCalculator.INSTANCE;
            case LATENCY -> LatencyCalculator.INSTANCE;
            case ERROR_RATE -> ErrorRateCalculator.INSTANCE;
            case GENERIC -> GenericAverageCalculator.INSTANCE;
        };
    }
}
