package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;

import java.util.List;

/**
 * Arithmetic mean of every retained sample, regardless of name. 0 for an
 * empty history.
 */
final class GenericAverageCalculator implements SliCalculator {

    static final GenericAverageCalculator INSTANCE = new GenericAverageCalculator();

    private GenericAverageCalculator() {
    }

    @Override
    public double calculate(List<Metric> history) {
        if (history.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (Metric metric : history) {
            sum += metric.getValue();
        }
        return sum / history.size();
    }
}
