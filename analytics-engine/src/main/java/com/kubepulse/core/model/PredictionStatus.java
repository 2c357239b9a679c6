package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Forecast health state carried by a {@link Prediction}.
 *
 * @since 1.0.0
 */
public enum PredictionStatus {

    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    UNKNOWN("unknown");

    private final String wireName;

    PredictionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a wire name, case-insensitively. Unrecognised values map to
     * {@link #UNKNOWN}.
     *
     * @param value wire name, may be {@code null}
     * @return matching status
     */
    @JsonCreator
    public static PredictionStatus fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (PredictionStatus status : values()) {
            if (status.wireName.equals(normalised)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
