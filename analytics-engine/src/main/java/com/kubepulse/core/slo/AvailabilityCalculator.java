package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;

import java.util.List;

/**
 * Availability in percent: {@code request_success / request_total * 100},
 * summed over the history. 100 when no requests were counted.
 */
final class AvailabilityCalculator implements SliCalculator {

    static final AvailabilityCalculator INSTANCE = new AvailabilityCalculator();

    private AvailabilityCalculator() {
    }

    @Override
    public double calculate(List<Metric> history) {
        double totalRequests = 0;
        double successfulRequests = 0;

        for (Metric metric : history) {
            if (REQUEST_TOTAL.equals(metric.getName())) {
                totalRequests += metric.getValue();
            } else if (REQUEST_SUCCESS.equals(metric.getName())) {
                successfulRequests += metric.getValue();
            }
        }

        if (totalRequests == 0) {
            return 100.0;
        }
        return (successfulRequests / totalRequests) * 100.0;
    }
}
