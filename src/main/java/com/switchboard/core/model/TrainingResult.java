package com.switchboard.core.model;

import java.util.List;

/**
 * Outcome of a training batch. Partial success is normal: {@code errors} lists
 * the examples that were skipped, {@code trainedCount} the ones applied.
 */
public record TrainingResult(
    boolean success,
    int trainedCount,
    List<String> errors
) {

    public TrainingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
