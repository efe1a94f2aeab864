package com.switchboard.core.llm;

import com.switchboard.core.model.TransformationRule;

import java.util.List;
import java.util.Map;

/**
 * Raw, loosely typed shape the model is asked to produce. Nothing here is
 * trusted until it passes {@link GenerativeResponseValidator}.
 */
public record GenerativeIntentPayload(
    String intent,
    Double confidence,
    Map<String, Object> entities,
    String action,
    Map<String, Object> parameters,
    String workflow,
    List<String> platforms,
    Boolean crossPlatformAction,
    Plan dataIntegration,
    Boolean requiresConfirmation
) {

    public record Plan(
        List<String> sourcePlatforms,
        List<String> targetPlatforms,
        String syncOperation,
        Map<String, String> entityMapping,
        List<TransformationRule> transformationRules
    ) {}
}
