package com.kubepulse.core.slo;

import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Slo;
import com.kubepulse.core.model.SloStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks declared SLOs, their sample history and their compliance status.
 *
 * <p>
 * Every {@link #updateMetrics(String, List)} appends to the SLO's history
 * (capped at {@value #MAX_HISTORY} samples, oldest dropped first) and
 * recomputes its status from the whole retained history:
 * </p>
 * <ul>
 * <li>current value via the SLI's {@link SliCalculator}</li>
 * <li>error budget: 100 at or above target, else {@code max(0, 100 - deficit * 10)}</li>
 * <li>burn rate over the last ten samples</li>
 * <li>violation: current value below target</li>
 * <li>time to exhaust, when under one week</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All three internal maps are guarded by one read/write lock. Mutations,
 * including the recompute they trigger, hold the write lock; lookups hold
 * the read lock and return copies.
 * </p>
 *
 * @since 1.0.0
 */
public class SloTracker {

    private static final Logger LOG = LoggerFactory.getLogger(SloTracker.class);

    /** Maximum samples retained per SLO. */
    public static final int MAX_HISTORY = 1000;

    private final Map<String, Slo> slos = new HashMap<>();
    private final Map<String, SloStatus> status = new HashMap<>();
    private final Map<String, List<Metric>> metrics = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Register an SLO, replacing any SLO of the same name, and reset its
     * status to the neutral state. Previously retained samples for that name
     * are kept.
     *
     * @param slo the SLO; must not be {@code null}
     */
    public void addSlo(Slo slo) {
        Objects.requireNonNull(slo, "SLO must not be null");

        lock.writeLock().lock();
        try {
            Slo previous = slos.put(slo.getName(), slo);
            status.put(slo.getName(), SloStatus.initial(slo));
            LOG.info("{} SLO [{}]: sli={} target={}",
                    previous == null ? "Registered" : "Replaced",
                    slo.getName(), slo.getSli().wireName(), slo.getTarget());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an SLO together with its status and history.
     *
     * @param sloName SLO name
     * @return {@code true} if the SLO existed
     */
    public boolean removeSlo(String sloName) {
        lock.writeLock().lock();
        try {
            metrics.remove(sloName);
            status.remove(sloName);
            boolean removed = slos.remove(sloName) != null;
            if (removed) {
                LOG.info("Removed SLO [{}]", sloName);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Append samples to an SLO's history and recompute its status. Unknown
     * SLO names are ignored.
     *
     * @param sloName SLO name
     * @param batch   samples in arrival order; neither the list nor any
     *                element may be {@code null}
     * @throws NullPointerException if {@code batch} or one of its elements is
     *                              {@code null}; the history is left unchanged
     */
    public void updateMetrics(String sloName, List<Metric> batch) {
        Objects.requireNonNull(batch, "Metrics list must not be null");
        for (Metric metric : batch) {
            Objects.requireNonNull(metric, "Metric must not be null");
        }

        lock.writeLock().lock();
        try {
            Slo slo = slos.get(sloName);
            if (slo == null) {
                LOG.debug("Ignoring {} metric(s) for unknown SLO [{}]", batch.size(), sloName);
                return;
            }

            List<Metric> history = metrics.computeIfAbsent(sloName, name -> new ArrayList<>());
            history.addAll(batch);
            if (history.size() > MAX_HISTORY) {
                history.subList(0, history.size() - MAX_HISTORY).clear();
            }

            calculateSloStatus(slo, status.get(sloName), history);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param sloName SLO name
     * @return a copy of the SLO's status, or empty if it is not registered
     */
    public Optional<SloStatus> getSloStatus(String sloName) {
        lock.readLock().lock();
        try {
            SloStatus current = status.get(sloName);
            return current == null ? Optional.empty() : Optional.of(current.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copies of every SLO status keyed by SLO name, sorted by name
     */
    public Map<String, SloStatus> getAllSlos() {
        lock.readLock().lock();
        try {
            Map<String, SloStatus> result = new LinkedHashMap<>();
            status.keySet().stream()
                    .sorted()
                    .forEach(name -> result.put(name, status.get(name).copy()));
            return Collections.unmodifiableMap(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param sloName SLO name
     * @return number of samples currently retained for the SLO
     */
    public int historySize(String sloName) {
        lock.readLock().lock();
        try {
            List<Metric> history = metrics.get(sloName);
            return history == null ? 0 : history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Status recomputation (caller holds the write lock)
    // ---------------------------------------------------------------

    private void calculateSloStatus(Slo slo, SloStatus current, List<Metric> history) {
        if (history.isEmpty()) {
            return;
        }
        boolean wasViolated = current.isViolated();

        double value = SliCalculator.forType(slo.getSli()).calculate(history);
        double errorBudget = ErrorBudget.remaining(value, slo.getTarget());
        double burnRate = ErrorBudget.burnRate(history);

        current.setCurrentValue(value);
        current.setErrorBudget(errorBudget);
        current.setBurnRate(burnRate);
        current.setViolated(value < slo.getTarget());
        current.setTimeToExhaust(ErrorBudget.timeToExhaust(errorBudget, burnRate)
                .map(Duration::toString)
                .orElse(null));

        if (current.isViolated() && !wasViolated) {
            LOG.warn("SLO [{}] violated: current={} target={} errorBudget={}",
                    slo.getName(), value, slo.getTarget(), errorBudget);
        } else if (!current.isViolated() && wasViolated) {
            LOG.info("SLO [{}] recovered: current={} target={}", slo.getName(), value, slo.getTarget());
        }
        LOG.debug("SLO [{}] recomputed: {}", slo.getName(), current);
    }
}
