package com.switchboard.core.llm;

import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.ResolutionPath;
import com.switchboard.core.model.ResolvedIntent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated generative classification. {@code action}, {@code workflow} and
 * {@code dataIntegration} are null when the model did not supply them.
 */
public record GenerativeResponse(
    String intent,
    double confidence,
    Map<String, Object> entities,
    String action,
    Map<String, Object> parameters,
    String workflow,
    List<String> platforms,
    boolean crossPlatformAction,
    DataIntegrationPlan dataIntegration,
    boolean requiresConfirmation
) {

    public GenerativeResponse {
        entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public ResolvedIntent toResolvedIntent() {
        return new ResolvedIntent(intent, confidence, entities, action != null ? action : intent,
                parameters.isEmpty() ? entities : parameters, workflow, platforms,
                crossPlatformAction || dataIntegration != null, dataIntegration, requiresConfirmation,
                List.of(), ResolutionPath.GENERATIVE.tag());
    }
}
