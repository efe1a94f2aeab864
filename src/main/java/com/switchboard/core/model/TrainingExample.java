package com.switchboard.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A labelled message in the append-only training log.
 */
public record TrainingExample(
    String message,
    String intent,
    Map<String, Object> entities,
    Instant timestamp,
    List<String> platforms,
    boolean crossPlatform
) {

    public TrainingExample {
        entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }
}
