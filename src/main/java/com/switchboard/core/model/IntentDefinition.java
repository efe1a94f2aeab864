package com.switchboard.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A named intent in the catalog: the phrase patterns that trigger it, the entity
 * types to extract, and the action it maps to.
 * <p>
 * Definitions are immutable. Training produces a new instance through
 * {@link #withLearnedMessage(String)}; patterns and examples only ever grow.
 */
public record IntentDefinition(
    String name,
    String description,
    List<String> patterns,
    List<String> examples,
    List<String> entities,
    String action,
    String workflow,
    boolean requiresConfirmation,
    List<String> confirmationPhrases,
    List<String> platforms,
    boolean crossPlatform,
    DataIntegrationPlan dataIntegration
) {

    public IntentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Intent name is required");
        }
        description = description == null ? "" : description;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        examples = examples == null ? List.of() : List.copyOf(examples);
        entities = entities == null ? List.of() : List.copyOf(entities);
        action = action == null || action.isBlank() ? name : action;
        confirmationPhrases = confirmationPhrases == null ? List.of() : List.copyOf(confirmationPhrases);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    /**
     * Shorthand for a single-platform intent with no confirmation and no plan template.
     */
    public static IntentDefinition simple(String name, String description, List<String> patterns,
                                          List<String> examples, List<String> entities,
                                          String action, String workflow) {
        return new IntentDefinition(name, description, patterns, examples, entities, action, workflow,
                false, List.of(), List.of(), false, null);
    }

    /**
     * Eligible for the cross-platform matching pass.
     */
    public boolean isCrossPlatformCandidate() {
        return crossPlatform && !platforms.isEmpty();
    }

    public boolean hasPattern(String candidate) {
        return patterns.stream().anyMatch(p -> p.equalsIgnoreCase(candidate));
    }

    /**
     * Returns a definition that also knows {@code message}: the lowercase form as a
     * pattern (skipped when a case-insensitive equal pattern exists) and the
     * original text as an example (skipped when already present). Returns
     * {@code this} when nothing was added.
     *
     * @throws IllegalArgumentException when {@code message} is null or blank
     */
    public IntentDefinition withLearnedMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        boolean addPattern = !hasPattern(message);
        boolean addExample = !examples.contains(message);
        if (!addPattern && !addExample) {
            return this;
        }
        List<String> newPatterns = patterns;
        if (addPattern) {
            newPatterns = new ArrayList<>(patterns);
            newPatterns.add(message.toLowerCase(Locale.ROOT));
        }
        List<String> newExamples = examples;
        if (addExample) {
            newExamples = new ArrayList<>(examples);
            newExamples.add(message);
        }
        return new IntentDefinition(name, description, newPatterns, newExamples, entities, action, workflow,
                requiresConfirmation, confirmationPhrases, platforms, crossPlatform, dataIntegration);
    }
}
