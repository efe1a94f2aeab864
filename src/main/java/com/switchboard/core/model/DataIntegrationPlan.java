package com.switchboard.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Describes how data flows from a set of source platforms into a set of target
 * platforms for a cross-platform action.
 * <p>
 * {@code entityMapping} keeps insertion order; its keys are distinct by construction.
 */
public record DataIntegrationPlan(
    List<String> sourcePlatforms,
    List<String> targetPlatforms,
    SyncOperation syncOperation,
    Map<String, String> entityMapping,
    List<TransformationRule> transformationRules
) {

    public DataIntegrationPlan {
        sourcePlatforms = sourcePlatforms == null ? List.of() : List.copyOf(sourcePlatforms);
        targetPlatforms = targetPlatforms == null ? List.of() : List.copyOf(targetPlatforms);
        if (syncOperation == null) {
            throw new IllegalArgumentException("syncOperation is required");
        }
        entityMapping = entityMapping == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entityMapping));
        transformationRules = transformationRules == null ? List.of() : List.copyOf(transformationRules);
    }

    /**
     * Lookup key used by the cross-platform mapper, e.g. {@code gmail-slack-to-asana-trello}.
     */
    public String key() {
        return keyOf(sourcePlatforms, targetPlatforms);
    }

    public static String keyOf(List<String> sources, List<String> targets) {
        return String.join("-", sources) + "-to-" + String.join("-", targets);
    }

    /**
     * All platforms this plan touches, sources first, without duplicates.
     */
    public List<String> allPlatforms() {
        var all = new LinkedHashSet<String>(sourcePlatforms);
        all.addAll(targetPlatforms);
        return List.copyOf(all);
    }
}
