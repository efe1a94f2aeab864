package com.switchboard.core.llm;

import com.switchboard.core.extract.PlatformCapability;
import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.IntentDefinition;
import com.switchboard.core.model.UserPreferences;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the generative classifier is told about a request.
 *
 * @param priorContext the caller's platform context blob, passed through as-is
 */
public record GenerativeRequest(
    String message,
    List<PlatformCapability> platforms,
    List<DataIntegrationPlan> integrationPatterns,
    UserPreferences preferences,
    Map<String, Object> priorContext,
    List<IntentDefinition> intents
) {

    public GenerativeRequest {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        integrationPatterns = integrationPatterns == null ? List.of() : List.copyOf(integrationPatterns);
        preferences = preferences == null ? UserPreferences.defaults() : preferences;
        priorContext = priorContext == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(priorContext));
        intents = intents == null ? List.of() : List.copyOf(intents);
    }
}
