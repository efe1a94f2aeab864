package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of data movement a {@link DataIntegrationPlan} performs between platforms.
 */
public enum SyncOperation {
    CREATE,
    UPDATE,
    DELETE,
    READ,
    SYNC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when validating generative output.
     */
    public static Optional<SyncOperation> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (SyncOperation op : values()) {
            if (op.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static SyncOperation fromJson(String value) {
        return fromValue(value).orElseThrow(
                () -> new IllegalArgumentException("Unknown sync operation: " + value));
    }
}
