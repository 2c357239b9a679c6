package com.kubepulse.core.detection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/**
 * Rolling estimate of a metric's normal range.
 *
 * <p>
 * Holds the most recent {@code capacity} observations and the population
 * mean and standard deviation of that window. A freshly created baseline
 * reports {@code mean = 0} and {@code stddev = 1}. The standard deviation is
 * floored at {@value #STDDEV_FLOOR} when the window has zero variance so
 * z-scores never divide by zero.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by {@link StatisticalAnomalyDetector} and only
 * touched under its lock.
 * </p>
 */
final class Baseline {

    static final double STDDEV_FLOOR = 1.0;

    private final int capacity;
    private final Deque<Double> window;

    private double mean = 0.0;
    private double stddev = STDDEV_FLOOR;
    private long count;

    Baseline(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Baseline capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.window = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Append a value, evicting the oldest once the window is full, and
     * recompute mean and standard deviation over the window.
     */
    void update(double value) {
        window.addLast(value);
        if (window.size() > capacity) {
            window.pollFirst();
        }
        count++;

        double sum = 0;
        for (double v : window) {
            sum += v;
        }
        mean = sum / window.size();

        double sumSquaredDiff = 0;
        for (double v : window) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        stddev = Math.sqrt(sumSquaredDiff / window.size());

        if (stddev == 0) {
            stddev = STDDEV_FLOOR;
        }
    }

    /**
     * @return distance of {@code value} from the mean in standard deviations
     */
    double zScore(double value) {
        return Math.abs(value - mean) / stddev;
    }

    double mean() {
        return mean;
    }

    double stddev() {
        return stddev;
    }

    /** Total observations ever recorded, including evicted ones. */
    long count() {
        return count;
    }

    int capacity() {
        return capacity;
    }

    BaselineSnapshot snapshot() {
        return new BaselineSnapshot(mean, stddev, count, new ArrayList<>(window));
    }
}
