package com.switchboard.core.resolver;

import com.switchboard.core.model.ConversationContext;
import com.switchboard.core.model.CrossPlatformEvent;
import com.switchboard.core.model.IntentDefinition;
import com.switchboard.core.model.ResolvedIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the follow-up lines offered with a resolved intent: confirmation
 * phrases, cross-platform progress messages and usage insights.
 */
@Component
public class SuggestionGenerator {

    static final int PATTERN_HISTORY_THRESHOLD = 5;
    static final int OPTIMIZATION_PLATFORM_THRESHOLD = 2;

    /**
     * @param insightCount how many of {@code responses} are insights
     */
    public record Suggestions(List<String> responses, int insightCount) {}

    /**
     * @param definition the catalog definition of the resolved intent, or null
     *                   when the intent is not in the catalog
     * @param context    may be null
     */
    public Suggestions complete(ResolvedIntent resolved, IntentDefinition definition, ConversationContext context) {
        var responses = new ArrayList<>(resolved.suggestedResponses());
        if (resolved.requiresConfirmation() && definition != null) {
            addAll(responses, definition.confirmationPhrases());
        }
        if (resolved.crossPlatformAction()) {
            addAll(responses, crossPlatformResponses(resolved.intent(), resolved.platforms()));
        }
        List<String> insights = insights(resolved, context);
        addAll(responses, insights);
        return new Suggestions(responses, insights.size());
    }

    List<String> crossPlatformResponses(String intent, List<String> platforms) {
        return switch (intent) {
            case "create_cross_platform_task" -> platforms.isEmpty()
                    ? List.of("Create task in all connected platforms?")
                    : List.of("Task will be created in " + String.join(" & ", platforms),
                            "Syncing task across " + platforms.size() + " platforms");
            case "cross_platform_search" -> List.of(
                    "Searching across all connected platforms...",
                    "Unified search results will be compiled");
            case "automated_workflow_trigger" -> List.of(
                    "Creating cross-platform automation rule...",
                    "Workflow will trigger automatically when conditions are met");
            default -> List.of(
                    "Executing cross-platform action...",
                    "Results will be synchronized across all platforms");
        };
    }

    List<String> insights(ResolvedIntent resolved, ConversationContext context) {
        List<CrossPlatformEvent> history = context == null ? List.of() : context.crossPlatformHistory();
        var insights = new ArrayList<String>();
        if (history.size() > PATTERN_HISTORY_THRESHOLD) {
            insights.add("I notice you frequently create cross-platform tasks. "
                    + "Would you like me to suggest a recurring automation?");
        }
        if (resolved.platforms().size() > OPTIMIZATION_PLATFORM_THRESHOLD) {
            insights.add("Consider creating a unified workspace template for your "
                    + resolved.platforms().size() + " most-used platforms");
        }
        if ("create_cross_platform_task".equals(resolved.intent())
                && history.stream().anyMatch(e -> "create_cross_platform_task".equals(e.action()))) {
            insights.add("Based on your activity, you might want to create similar tasks tomorrow at 9am");
        }
        return insights;
    }

    private static void addAll(List<String> target, List<String> values) {
        for (String value : values) {
            if (!target.contains(value)) {
                target.add(value);
            }
        }
    }
}
