package com.kubepulse.core.detection;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only copy of a metric's baseline at one point in time.
 *
 * @since 1.0.0
 */
public final class BaselineSnapshot {

    private final double mean;
    private final double stddev;
    private final long count;
    private final List<Double> window;

    BaselineSnapshot(double mean, double stddev, long count, List<Double> window) {
        this.mean = mean;
        this.stddev = stddev;
        this.count = count;
        this.window = Collections.unmodifiableList(window);
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    /** Observations recorded since the baseline was created. */
    public long getCount() {
        return count;
    }

    /**
     * @return retained values, oldest first
     */
    public List<Double> getWindow() {
        return window;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineSnapshot that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stddev, that.stddev) == 0
                && count == that.count
                && window.equals(that.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stddev, count, window);
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{" +
                "mean=" + mean +
                ", stddev=" + stddev +
                ", count=" + count +
                ", windowSize=" + window.size() +
                '}';
    }
}
