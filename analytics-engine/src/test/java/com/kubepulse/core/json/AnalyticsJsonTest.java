package com.kubepulse.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubepulse.core.model.BudgetAction;
import com.kubepulse.core.model.Metric;
import com.kubepulse.core.model.Prediction;
import com.kubepulse.core.model.PredictionStatus;
import com.kubepulse.core.model.SliType;
import com.kubepulse.core.model.Slo;
import com.kubepulse.core.model.SloStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalyticsJson}.
 */
class AnalyticsJsonTest {

    private static final ObjectMapper MAPPER = AnalyticsJson.newObjectMapper();

    private static final Instant TS = Instant.parse("2026-10-18T13:00:00Z");

    @Test
    @DisplayName("Should write predictions with ISO timestamps and lower-case status")
    void shouldWritePrediction() throws Exception {
        Prediction prediction = Prediction.builder()
                .timestamp(TS)
                .status(PredictionStatus.DEGRADED)
                .probability(0.35)
                .reason(Prediction.STATISTICAL_ANOMALY)
                .build();

        JsonNode json = MAPPER.readTree(AnalyticsJson.toJson(prediction));

        assertThat(json.get("timestamp").asText()).isEqualTo("2026-10-18T13:00:00Z");
        assertThat(json.get("status").asText()).isEqualTo("degraded");
        assertThat(json.get("probability").asDouble()).isEqualTo(0.35);
        assertThat(json.get("reason").asText()).isEqualTo("Statistical anomaly detected");
        assertThat(AnalyticsJson.predictionsFromJson("[" + AnalyticsJson.toJson(prediction) + "]"))
                .containsExactly(prediction);
    }

    @Test
    @DisplayName("Should write SLO status with isViolated and omit a missing time to exhaust")
    void shouldWriteStatus() throws Exception {
        SloStatus status = SloStatus.initial(slo());
        status.setCurrentValue(99.0);
        status.setErrorBudget(95.0);
        status.setBurnRate(10.0);
        status.setViolated(true);

        JsonNode json = MAPPER.readTree(AnalyticsJson.toJson(status));

        assertThat(json.has("isViolated")).isTrue();
        assertThat(json.get("isViolated").asBoolean()).isTrue();
        assertThat(json.has("violated")).isFalse();
        assertThat(json.has("timeToExhaust")).isFalse();
        assertThat(json.get("currentValue").asDouble()).isEqualTo(99.0);
        assertThat(json.get("errorBudget").asDouble()).isEqualTo(95.0);
        assertThat(json.get("burnRate").asDouble()).isEqualTo(10.0);
        assertThat(json.at("/slo/sli").asText()).isEqualTo("availability");
        assertThat(json.at("/slo/window").asText()).isEqualTo("PT720H");
        assertThat(json.at("/slo/budgetPolicy/0/action").asText()).isEqualTo("page");

        status.setTimeToExhaust("PT9H30M");
        assertThat(MAPPER.readTree(AnalyticsJson.toJson(status)).get("timeToExhaust").asText())
                .isEqualTo("PT9H30M");
    }

    @Test
    @DisplayName("Should read a status table back into equal statuses")
    void shouldReadStatusTable() {
        SloStatus status = SloStatus.initial(slo());
        status.setTimeToExhaust("PT20H");

        Map<String, SloStatus> table = AnalyticsJson.statusTableFromJson(
                AnalyticsJson.toJson(Map.of("api", status)));

        assertThat(table).containsOnlyKeys("api");
        assertThat(table.get("api")).isEqualTo(status);
        assertThat(table.get("api").timeToExhaust()).contains("PT20H");
    }

    @Test
    @DisplayName("Should read metrics with defaults for optional fields")
    void shouldReadMetric() {
        Metric metric = AnalyticsJson.fromJson(
                "{\"name\":\"cpu\",\"value\":42.5,\"timestamp\":\"2026-10-18T13:00:00Z\",\"extra\":true}",
                Metric.class);

        assertThat(metric.getName()).isEqualTo("cpu");
        assertThat(metric.getValue()).isEqualTo(42.5);
        assertThat(metric.getUnit()).isEmpty();
        assertThat(metric.getLabels()).isEmpty();
        assertThat(metric.getTimestamp()).isEqualTo(TS);
    }

    @Test
    @DisplayName("Should read back a written metric with its unit and labels")
    void shouldRoundTripMetric() {
        Metric metric = Metric.builder()
                .name("pod_restarts")
                .value(3)
                .unit("count")
                .label("namespace", "payments")
                .label("pod", "api-7f9c")
                .timestamp(TS)
                .build();

        assertThat(AnalyticsJson.fromJson(AnalyticsJson.toJson(metric), Metric.class)).isEqualTo(metric);
    }

    @Test
    @DisplayName("Should omit empty unit and labels when writing a metric")
    void shouldOmitEmptyMetricFields() throws Exception {
        JsonNode json = MAPPER.readTree(AnalyticsJson.toJson(
                Metric.builder().name("cpu").value(1).timestamp(TS).build()));

        assertThat(json.has("unit")).isFalse();
        assertThat(json.has("labels")).isFalse();
        assertThat(json.get("value").asDouble()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should map unknown wire names to the fallback constants")
    void shouldMapUnknownEnums() {
        Prediction prediction = AnalyticsJson.fromJson(
                "{\"timestamp\":\"2026-10-18T13:00:00Z\",\"status\":\"exploded\",\"probability\":1}",
                Prediction.class);
        Slo slo = AnalyticsJson.fromJson("{\"name\":\"x\",\"sli\":\"throughput\",\"target\":5}", Slo.class);

        assertThat(prediction.getStatus()).isEqualTo(PredictionStatus.UNKNOWN);
        assertThat(slo.getSli()).isEqualTo(SliType.GENERIC);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> AnalyticsJson.fromJson("{not json", Metric.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed Metric JSON");
        assertThatThrownBy(() -> AnalyticsJson.predictionsFromJson("{}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed prediction list JSON");
    }

    @Test
    @DisplayName("Should write prediction lists as JSON arrays")
    void shouldWriteLists() throws Exception {
        JsonNode json = MAPPER.readTree(AnalyticsJson.toJson(List.of()));

        assertThat(json.isArray()).isTrue();
        assertThat(json.size()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Slo slo() {
        return Slo.builder()
                .name("api")
                .description("API availability")
                .sli(SliType.AVAILABILITY)
                .target(99.5)
                .window(Duration.ofDays(30))
                .budgetRule(90, BudgetAction.PAGE)
                .build();
    }
}
