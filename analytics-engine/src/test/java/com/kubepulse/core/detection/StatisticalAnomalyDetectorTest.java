package com.kubepulse.core.detection;

import com.kubepulse.core.config.DetectorSettings;
import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Prediction;
import com.kubepulse.core.model.PredictionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalAnomalyDetector}.
 */
class StatisticalAnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    private StatisticalAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new StatisticalAnomalyDetector(DetectorSettings.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should never predict during the first ten observations of a metric")
    void shouldNotFireDuringWarmup() {
        List<Metric> wild = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            wild.add(metric("cpu", i % 2 == 0 ? 1.0 : 1_000_000.0));
        }

        assertThat(detector.detectAnomalies(wild)).isEmpty();
        assertThat(detector.baselineSnapshot("cpu")).get()
                .extracting(BaselineSnapshot::getCount).isEqualTo(10L);
    }

    @Test
    @DisplayName("Should NOT fire on values close to the mean")
    void shouldNotFireOnNormalValues() {
        List<Metric> normal = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            normal.add(metric("cpu", 50.0 + i % 5));
        }

        assertThat(detector.detectAnomalies(normal)).isEmpty();
    }

    @Test
    @DisplayName("Should fire a degraded prediction one hour ahead on an extreme outlier")
    void shouldFireOnOutlier() {
        detector.detectAnomalies(repeat("cpu", 50.0, 12));

        List<Prediction> predictions = detector.detectAnomalies(List.of(metric("cpu", 500.0)));

        assertThat(predictions).hasSize(1);
        Prediction prediction = predictions.get(0);
        assertThat(prediction.getStatus()).isEqualTo(PredictionStatus.DEGRADED);
        assertThat(prediction.getReason()).isEqualTo("Statistical anomaly detected");
        assertThat(prediction.getTimestamp()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(prediction.getProbability()).isCloseTo(0.34641, within(1e-5));
    }

    @Test
    @DisplayName("Should score probability against the baseline after the outlier was absorbed")
    void shouldScoreAfterAbsorbingOutlier() {
        detector.detectAnomalies(repeat("cpu", 50.0, 10));

        List<Prediction> predictions = detector.detectAnomalies(List.of(metric("cpu", 1e9)));

        // window is ten 50s plus the outlier: its z-score is exactly sqrt(10)
        assertThat(predictions).hasSize(1);
        assertThat(predictions.get(0).getProbability()).isCloseTo(Math.sqrt(10) / 10, within(1e-9));
    }

    @Test
    @DisplayName("Should absorb a sustained shift and stop reporting it")
    void shouldAbsorbSustainedShift() {
        detector.detectAnomalies(repeat("cpu", 50.0, 10));

        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            if (!detector.detectAnomalies(List.of(metric("cpu", 100.0))).isEmpty()) {
                flagged.add(i);
            }
        }

        assertThat(flagged).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should keep baselines independent per metric name")
    void shouldIsolateMetricNames() {
        detector.detectAnomalies(repeat("cpu", 50.0, 10));

        // memory is still warming up, so the same jump is not reported for it
        List<Prediction> predictions = detector.detectAnomalies(List.of(
                metric("memory", 5_000.0),
                metric("cpu", 5_000.0)));

        assertThat(predictions).hasSize(1);
        assertThat(detector.trackedMetrics()).containsExactly("cpu", "memory");
        assertThat(detector.baselineSnapshot("memory")).get()
                .extracting(BaselineSnapshot::getCount).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should report anomalies in input order and drop normal metrics")
    void shouldPreserveInputOrder() {
        detector.detectAnomalies(repeat("a", 10.0, 10));
        detector.detectAnomalies(repeat("b", 10.0, 10));

        List<Prediction> predictions = detector.detectAnomalies(List.of(
                metric("a", 1_000.0),
                metric("b", 10.0),
                metric("b", 100_000.0)));

        // a is scored over 11 values (z = sqrt(10)), b over 12 (z = sqrt(11))
        assertThat(predictions).hasSize(2);
        assertThat(predictions.get(0).getProbability()).isCloseTo(Math.sqrt(10) / 10, within(1e-9));
        assertThat(predictions.get(1).getProbability()).isCloseTo(Math.sqrt(11) / 10, within(1e-9));
    }

    @Test
    @DisplayName("Should keep only the most recent 100 values per baseline")
    void shouldCapBaselineWindow() {
        List<Metric> metrics = new ArrayList<>();
        for (int i = 0; i < 130; i++) {
            metrics.add(metric("latency", i));
        }
        detector.detectAnomalies(metrics);

        BaselineSnapshot snapshot = detector.baselineSnapshot("latency").orElseThrow();
        assertThat(snapshot.getWindow()).hasSize(100);
        assertThat(snapshot.getWindow().get(0)).isEqualTo(30.0);
        assertThat(snapshot.getWindow().get(99)).isEqualTo(129.0);
        assertThat(snapshot.getCount()).isEqualTo(130);
    }

    @Test
    @DisplayName("Should return an empty snapshot for an unseen metric")
    void shouldReturnEmptySnapshotForUnknownMetric() {
        assertThat(detector.baselineSnapshot("never-seen")).isEmpty();
        assertThat(detector.detectAnomalies(Collections.emptyList())).isEmpty();
    }

    @Test
    @DisplayName("Should honour a custom threshold, warm-up and horizon")
    void shouldHonourCustomSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setThreshold(100.0);
        settings.setWarmupSamples(2);
        settings.setPredictionHorizon("30m");
        StatisticalAnomalyDetector strict = new StatisticalAnomalyDetector(settings,
                Clock.fixed(NOW, ZoneOffset.UTC));

        strict.detectAnomalies(repeat("cpu", 50.0, 2));

        assertThat(strict.detectAnomalies(List.of(metric("cpu", 120.0)))).isEmpty();
        List<Prediction> predictions = strict.detectAnomalies(List.of(metric("cpu", 1e7)));
        assertThat(predictions).hasSize(1);
        assertThat(predictions.get(0).getTimestamp()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setThreshold(0);
        assertThatThrownBy(() -> new StatisticalAnomalyDetector(settings))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");

        DetectorSettings tiny = new DetectorSettings();
        tiny.setWindowCapacity(1);
        assertThatThrownBy(() -> new StatisticalAnomalyDetector(tiny))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowCapacity");
    }

    @Test
    @DisplayName("Should stay consistent under concurrent detection calls")
    void shouldHandleConcurrentCallers() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        detector.detectAnomalies(List.of(metric("shared", i % 7), metric("other", 1.0)));
                        detector.baselineSnapshot("shared");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(detector.baselineSnapshot("shared").orElseThrow().getCount())
                .isEqualTo((long) threads * perThread);
        assertThat(detector.baselineSnapshot("shared").orElseThrow().getWindow()).hasSize(100);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Metric metric(String name, double value) {
        return Metric.builder().name(name).value(value).unit("%").timestamp(NOW).build();
    }

    private static List<Metric> repeat(String name, double value, int times) {
        List<Metric> metrics = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            metrics.add(metric(name, value));
        }
        return metrics;
    }
}
