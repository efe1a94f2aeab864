package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Resolution strategy requested by the caller. {@link #HYBRID} is the default;
 * the explicit modes bypass the hybrid decision logic.
 */
public enum ResolutionMode {
    RULES,
    GENERATIVE,
    HYBRID;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResolutionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
