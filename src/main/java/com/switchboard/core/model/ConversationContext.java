package com.switchboard.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session conversation state. Created when a session starts and replaced
 * after every resolution via {@link #afterResolution(ResolvedIntent, Instant)};
 * persistence belongs to the caller.
 */
public record ConversationContext(
    String userId,
    String sessionId,
    List<String> previousIntents,
    Map<String, Object> entities,
    Map<String, Object> platformContext,
    List<CrossPlatformEvent> crossPlatformHistory,
    UserPreferences userPreferences
) {

    public ConversationContext {
        previousIntents = previousIntents == null ? List.of() : List.copyOf(previousIntents);
        entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        platformContext = platformContext == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(platformContext));
        crossPlatformHistory = crossPlatformHistory == null ? List.of() : List.copyOf(crossPlatformHistory);
        userPreferences = userPreferences == null ? UserPreferences.defaults() : userPreferences;
    }

    public static ConversationContext newSession(String userId, String sessionId) {
        return new ConversationContext(userId, sessionId, List.of(), Map.of(), Map.of(), List.of(),
                UserPreferences.defaults());
    }

    /**
     * Returns the context as it stands after {@code resolved}: the intent is
     * appended to the history, its entities are merged into the entity memory
     * (newer values win) and, for cross-platform actions, one history entry is
     * added per target platform.
     */
    public ConversationContext afterResolution(ResolvedIntent resolved, Instant at) {
        var intents = new ArrayList<>(previousIntents);
        intents.add(resolved.intent());

        var mergedEntities = new LinkedHashMap<>(entities);
        mergedEntities.putAll(resolved.entities());

        var history = new ArrayList<>(crossPlatformHistory);
        if (resolved.crossPlatformAction()) {
            for (String platform : resolved.platforms()) {
                history.add(new CrossPlatformEvent(platform, resolved.action(), at, resolved.resolutionPath()));
            }
        }
        return new ConversationContext(userId, sessionId, intents, mergedEntities, platformContext, history,
                userPreferences);
    }
}
