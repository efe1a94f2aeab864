package com.switchboard.core.model;

import java.util.List;
import java.util.Map;

/**
 * Per-user preference profile carried in a {@link ConversationContext}.
 *
 * @param preferredPlatforms capability → preferred platform, e.g. {@code task_management → asana}
 */
public record UserPreferences(
    Map<String, String> preferredPlatforms,
    AutomationLevel automationLevel,
    List<String> integrationPatterns
) {

    public UserPreferences {
        preferredPlatforms = preferredPlatforms == null ? Map.of() : Map.copyOf(preferredPlatforms);
        automationLevel = automationLevel == null ? AutomationLevel.MANUAL : automationLevel;
        integrationPatterns = integrationPatterns == null ? List.of() : List.copyOf(integrationPatterns);
    }

    public static UserPreferences defaults() {
        return new UserPreferences(Map.of(), AutomationLevel.MANUAL, List.of());
    }
}
