package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;

import java.util.ArrayList;
import java.util.List;

/**
 * Approximate p95 of {@code request_duration} samples.
 *
 * <p>
 * Picks index {@code round(0.95 * (n - 1))} of the samples <em>in arrival
 * order</em>; the samples are deliberately not sorted, so the result is a
 * rank-indexed sample rather than a true order statistic. 0 when there are no
 * latency samples.
 * </p>
 */
final class LatencyCalculator implements SliCalculator {

    static final LatencyCalculator INSTANCE = new LatencyCalculator();

    static final double PERCENTILE = 95.0;

    private LatencyCalculator() {
    }

    @Override
    public double calculate(List<Metric> history) {
        List<Double> latencies = new ArrayList<>();
        for (Metric metric : history) {
            if (REQUEST_DURATION.equals(metric.getName())) {
                latencies.add(metric.getValue());
            }
        }
        return percentile(latencies, PERCENTILE);
    }

    static double percentile(List<Double> values, double p) {
        if (values.isEmpty()) {
            return 0.0;
        }
        int index = (int) (p / 100.0 * (values.size() - 1) + 0.5);
        if (index >= values.size()) {
            index = values.size() - 1;
        }
        return values.get(index);
    }
}
