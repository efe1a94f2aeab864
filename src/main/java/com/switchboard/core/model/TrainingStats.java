package com.switchboard.core.model;

import java.time.Instant;
import java.util.Map;

public record TrainingStats(
    int totalExamples,
    Map<String, Integer> examplesByIntent,
    Instant oldestExample,
    Instant newestExample
) {}
