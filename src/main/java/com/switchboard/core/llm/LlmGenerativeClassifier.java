package com.switchboard.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.extract.PlatformCapability;
import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.IntentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * {@link GenerativeClassifier} backed by the configured chat model.
 * <p>
 * Renders the request into a prompt, asks {@link LlmService} for a
 * {@link GenerativeIntentPayload} and validates it before returning.
 */
@Component
public class LlmGenerativeClassifier implements GenerativeClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmGenerativeClassifier.class);

    static final String SYSTEM_PROMPT = """
            You are the intent classifier of Switchboard, an assistant that turns requests into
            actions across many connected work platforms.
            Classify the user's message into:
            - intent: snake_case intent name; prefer one of the known intents when it fits
            - confidence: 0.0-1.0
            - entities: values mentioned in the message (task_name, date, time, participants, project, ...)
            - action and parameters: what should be executed and with which arguments
            - platforms: platforms the action targets, using the platform names listed
            - crossPlatformAction: true when the action spans more than one platform
            - dataIntegration: only for cross-platform data movement, with sourcePlatforms,
              targetPlatforms, syncOperation (one of "create", "update", "delete", "read", "sync")
              and entityMapping
            - requiresConfirmation: true for actions that change external systems irreversibly

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    public LlmGenerativeClassifier(LlmService llmService, LlmProperties properties, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerativeResponse classify(GenerativeRequest request) {
        if (!properties.isEnabled()) {
            throw new IllegalStateException("Generative classification is disabled");
        }
        GenerativeIntentPayload payload = llmService.structuredCall(
                SYSTEM_PROMPT, buildUserPrompt(request), GenerativeIntentPayload.class);
        GenerativeResponse response = GenerativeResponseValidator.validate(payload);
        log.debug("Generative classification: {} ({})", response.intent(), response.confidence());
        return response;
    }

    String buildUserPrompt(GenerativeRequest request) {
        String platforms = request.platforms().stream()
                .map(LlmGenerativeClassifier::describe)
                .collect(Collectors.joining("\n"));
        String integrations = request.integrationPatterns().stream()
                .map(LlmGenerativeClassifier::describe)
                .collect(Collectors.joining("\n"));
        String intents = request.intents().stream()
                .map(LlmGenerativeClassifier::describe)
                .collect(Collectors.joining("\n"));
        return """
                AVAILABLE PLATFORMS:
                %s

                CROSS-PLATFORM INTEGRATIONS:
                %s

                KNOWN INTENTS:
                %s

                USER PREFERENCES:
                %s

                PREVIOUS CONTEXT:
                %s

                USER MESSAGE: "%s"
                """.formatted(platforms, integrations, intents,
                toJson(request.preferences()), toJson(request.priorContext()), request.message());
    }

    private static String describe(PlatformCapability platform) {
        return "- " + platform.name() + ": " + String.join(", ", platform.capabilities());
    }

    private static String describe(DataIntegrationPlan plan) {
        return "- " + plan.key() + ": " + String.join(" & ", plan.sourcePlatforms()) + " "
                + plan.syncOperation().wireName() + " " + String.join(" & ", plan.targetPlatforms());
    }

    private static String describe(IntentDefinition intent) {
        String examples = intent.examples().stream().limit(2)
                .map(e -> "\"" + e + "\"")
                .collect(Collectors.joining(", "));
        return "- " + intent.name() + ": " + intent.description()
                + (examples.isEmpty() ? "" : " (e.g. " + examples + ")");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not render prompt context as JSON: {}", e.getMessage());
            return String.valueOf(value);
        }
    }
}
