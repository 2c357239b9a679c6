package com.kubepulse.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kubepulse.core.model.Prediction;
import com.kubepulse.core.model.SloStatus;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON wire format for metrics, predictions, SLOs and SLO statuses.
 *
 * <p>
 * Instants and durations are written as ISO-8601 strings, enums as their
 * lower-case wire names. Unknown properties are ignored on read so older
 * readers tolerate newer payloads.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsJson {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private static final TypeReference<List<Prediction>> PREDICTIONS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, SloStatus>> STATUS_TABLE = new TypeReference<>() {
    };

    private AnalyticsJson() {
        // utility class
    }

    /**
     * @return a new mapper configured for the analytics wire format
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * @param value any model object or collection of them
     * @return JSON text
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + describe(value) + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param json JSON text; must not be {@code null}
     * @param type target type; must not be {@code null}
     * @return the parsed value
     * @throws IllegalArgumentException if the JSON is malformed or does not
     *                                  match {@code type}
     */
    public static <T> T fromJson(String json, Class<T> type) {
        Objects.requireNonNull(json, "JSON text must not be null");
        Objects.requireNonNull(type, "Target type must not be null");
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Malformed " + type.getSimpleName() + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param json JSON array of predictions
     * @return parsed predictions
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static List<Prediction> predictionsFromJson(String json) {
        return read(json, PREDICTIONS, "prediction list");
    }

    /**
     * @param json JSON object mapping SLO names to statuses
     * @return parsed status table
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static Map<String, SloStatus> statusTableFromJson(String json) {
        return read(json, STATUS_TABLE, "SLO status table");
    }

    private static <T> T read(String json, TypeReference<T> type, String what) {
        Objects.requireNonNull(json, "JSON text must not be null");
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
