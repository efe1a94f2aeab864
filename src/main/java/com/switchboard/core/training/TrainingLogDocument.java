package com.switchboard.core.training;

import com.switchboard.core.model.TrainingExample;

import java.time.Instant;
import java.util.List;

/**
 * On-disk form of the training log.
 */
public record TrainingLogDocument(
    String version,
    Instant lastUpdated,
    List<TrainingExample> examples
) {

    public static final String CURRENT_VERSION = "1.0.0";

    public TrainingLogDocument {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
