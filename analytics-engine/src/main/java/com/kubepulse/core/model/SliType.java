package com.kubepulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Service Level Indicator an SLO is evaluated against.
 *
 * <p>
 * Any indicator name other than {@code availability}, {@code latency} or
 * {@code error_rate} resolves to {@link #GENERIC}, which averages all
 * retained samples.
 * </p>
 *
 * @since 1.0.0
 */
public enum SliType {

    AVAILABILITY("availability"),
    LATENCY("latency"),
    ERROR_RATE("error_rate"),
    GENERIC("generic");

    private final String wireName;

    SliType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @param value indicator name, may be {@code null}
     * @return matching type, {@link #GENERIC} for anything unrecognised
     */
    @JsonCreator
    public static SliType fromWireName(String value) {
        if (value == null) {
            return GENERIC;
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (SliType type : values()) {
            if (type.wireName.equals(normalised)) {
                return type;
            }
        }
        return GENERIC;
    }
}
