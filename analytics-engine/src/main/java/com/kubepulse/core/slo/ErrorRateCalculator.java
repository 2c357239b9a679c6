package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;

import java.util.List;

/**
 * Error-rate SLI, reported as its success-rate complement:
 * {@code 100 - request_errors / request_total * 100}. 0 when no requests
 * were counted.
 */
final class ErrorRateCalculator implements SliCalculator {

    static final ErrorRateCalculator INSTANCE = new ErrorRateCalculator();

    private ErrorRateCalculator() {
    }

    @Override
    public double calculate(List<Metric> history) {
        double totalRequests = 0;
        double errorRequests = 0;

        for (Metric metric : history) {
            if (REQUEST_TOTAL.equals(metric.getName())) {
                totalRequests += metric.getValue();
            } else if (REQUEST_ERRORS.equals(metric.getName())) {
                errorRequests += metric.getValue();
            }
        }

        if (totalRequests == 0) {
            return 0.0;
        }
        return 100.0 - (errorRequests / totalRequests) * 100.0;
    }
}
