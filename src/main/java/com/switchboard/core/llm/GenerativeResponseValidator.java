package com.switchboard.core.llm;

import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.SyncOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a raw {@link GenerativeIntentPayload} into a {@link GenerativeResponse}
 * or rejects it with {@link LlmParseException}.
 */
public final class GenerativeResponseValidator {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private GenerativeResponseValidator() {} // utility class

    public static GenerativeResponse validate(GenerativeIntentPayload payload) {
        if (payload == null) {
            throw new LlmParseException("Generative response is empty");
        }
        if (payload.intent() == null || payload.intent().isBlank()) {
            throw new LlmParseException("Generative response has no intent");
        }
        double confidence = payload.confidence() == null ? DEFAULT_CONFIDENCE : payload.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new LlmParseException("Generative confidence out of range: " + payload.confidence());
        }
        return new GenerativeResponse(
                payload.intent().trim(),
                confidence,
                withoutNullValues(payload.entities()),
                blankToNull(payload.action()),
                withoutNullValues(payload.parameters()),
                blankToNull(payload.workflow()),
                cleanPlatforms(payload.platforms()),
                Boolean.TRUE.equals(payload.crossPlatformAction()),
                toPlan(payload.dataIntegration()),
                Boolean.TRUE.equals(payload.requiresConfirmation()));
    }

    static DataIntegrationPlan toPlan(GenerativeIntentPayload.Plan plan) {
        if (plan == null) {
            return null;
        }
        SyncOperation operation = SyncOperation.fromValue(plan.syncOperation())
                .orElseThrow(() -> new LlmParseException("Unknown syncOperation: " + plan.syncOperation()));
        List<String> sources = cleanPlatforms(plan.sourcePlatforms());
        List<String> targets = cleanPlatforms(plan.targetPlatforms());
        if (sources.isEmpty() || targets.isEmpty()) {
            throw new LlmParseException("Data integration plan needs source and target platforms");
        }
        return new DataIntegrationPlan(sources, targets, operation,
                plan.entityMapping() == null ? Map.of() : withoutNullStringValues(plan.entityMapping()),
                plan.transformationRules() == null
                        ? List.of()
                        : plan.transformationRules().stream().filter(Objects::nonNull).toList());
    }

    private static List<String> cleanPlatforms(List<String> platforms) {
        if (platforms == null) {
            return List.of();
        }
        var cleaned = new ArrayList<String>();
        for (String platform : platforms) {
            if (platform != null && !platform.isBlank() && !cleaned.contains(platform.trim())) {
                cleaned.add(platform.trim());
            }
        }
        return cleaned;
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> map) {
        var result = new LinkedHashMap<String, Object>();
        if (map != null) {
            map.forEach((key, value) -> {
                if (key != null && value != null) {
                    result.put(key, value);
                }
            });
        }
        return result;
    }

    private static Map<String, String> withoutNullStringValues(Map<String, String> map) {
        var result = new LinkedHashMap<String, String>();
        map.forEach((key, value) -> {
            if (key != null && value != null) {
                result.put(key, value);
            }
        });
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
