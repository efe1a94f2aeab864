package com.switchboard.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of resolving a free-text request.
 * <p>
 * {@code resolutionPath} is a diagnostic tag naming the path that produced the
 * result ({@code rules}, {@code rules_priority}, {@code ai_enhanced}, ...);
 * see {@link ResolutionPath}.
 */
public record ResolvedIntent(
    String intent,
    double confidence,
    Map<String, Object> entities,
    String action,
    Map<String, Object> parameters,
    String workflow,
    List<String> platforms,
    boolean crossPlatformAction,
    DataIntegrationPlan dataIntegration,
    boolean requiresConfirmation,
    List<String> suggestedResponses,
    String resolutionPath
) {

    public static final String UNKNOWN_INTENT = "unknown";

    public ResolvedIntent {
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("intent is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        action = action == null ? "respond" : action;
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        suggestedResponses = suggestedResponses == null ? List.of() : List.copyOf(suggestedResponses);
    }

    public boolean isUnknown() {
        return UNKNOWN_INTENT.equals(intent);
    }

    public ResolvedIntent withResolutionPath(ResolutionPath path) {
        return new ResolvedIntent(intent, confidence, entities, action, parameters, workflow, platforms,
                crossPlatformAction, dataIntegration, requiresConfirmation, suggestedResponses, path.tag());
    }

    public ResolvedIntent withDataIntegration(DataIntegrationPlan plan, List<String> mergedPlatforms) {
        return new ResolvedIntent(intent, confidence, entities, action, parameters, workflow, mergedPlatforms,
                true, plan, requiresConfirmation, suggestedResponses, resolutionPath);
    }

    public ResolvedIntent withSuggestedResponses(List<String> responses) {
        return new ResolvedIntent(intent, confidence, entities, action, parameters, workflow, platforms,
                crossPlatformAction, dataIntegration, requiresConfirmation, responses, resolutionPath);
    }
}
