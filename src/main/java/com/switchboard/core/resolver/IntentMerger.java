package com.switchboard.core.resolver;

import com.switchboard.core.llm.GenerativeResponse;
import com.switchboard.core.model.ResolutionPath;
import com.switchboard.core.model.ResolvedIntent;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Combines a low-confidence rule result with a generative one.
 * <p>
 * The generative side supplies the intent and confidence and wins entity and
 * parameter collisions; its action, workflow and plan replace the rule's only
 * when present. Platforms are the rule's followed by any new generative ones.
 */
public final class IntentMerger {

    private IntentMerger() {} // utility class

    public static ResolvedIntent merge(ResolvedIntent rule, GenerativeResponse generative) {
        var entities = new LinkedHashMap<>(rule.entities());
        entities.putAll(generative.entities());

        var parameters = new LinkedHashMap<>(rule.parameters());
        parameters.putAll(generative.parameters());

        var platforms = new LinkedHashSet<>(rule.platforms());
        platforms.addAll(generative.platforms());

        var plan = generative.dataIntegration() != null ? generative.dataIntegration() : rule.dataIntegration();

        return new ResolvedIntent(
                generative.intent(),
                generative.confidence(),
                entities,
                generative.action() != null ? generative.action() : rule.action(),
                parameters,
                generative.workflow() != null ? generative.workflow() : rule.workflow(),
                List.copyOf(platforms),
                rule.crossPlatformAction() || generative.crossPlatformAction() || generative.dataIntegration() != null,
                plan,
                rule.requiresConfirmation() || generative.requiresConfirmation(),
                rule.suggestedResponses(),
                ResolutionPath.AI_ENHANCED.tag());
    }
}
