package com.switchboard.core.resolver;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.extract.EntityExtractor;
import com.switchboard.core.extract.PlatformCatalog;
import com.switchboard.core.extract.PlatformDetection;
import com.switchboard.core.extract.PlatformDetector;
import com.switchboard.core.integration.CrossPlatformMapper;
import com.switchboard.core.llm.GenerativeClassifier;
import com.switchboard.core.llm.GenerativeRequest;
import com.switchboard.core.llm.GenerativeResponse;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.match.PatternMatch;
import com.switchboard.core.match.PatternMatcher;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.ConversationContext;
import com.switchboard.core.model.DataIntegrationPlan;
import com.switchboard.core.model.IntentDefinition;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolutionPath;
import com.switchboard.core.model.ResolvedIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a message to a {@link ResolvedIntent} by combining pattern rules
 * with the generative classifier.
 * <p>
 * In hybrid mode a rule match at or above its acceptance threshold is returned
 * directly. Otherwise the classifier is asked, bounded by a timeout; its answer
 * is merged with the rule result when there is one. Any classifier failure
 * falls back to the rule result, and with no rule result to the {@code unknown}
 * intent. {@link #resolve} never throws.
 */
@Service
public class HybridResolver {

    private static final Logger log = LoggerFactory.getLogger(HybridResolver.class);

    static final double UNKNOWN_CONFIDENCE = 0.1;
    static final List<String> UNKNOWN_FOLLOW_UPS = List.of(
            "I'm not sure I understand. Could you rephrase that?",
            "Could you provide more details about what you'd like to do?",
            "I don't recognize that command. Here's what I can help with:");

    private record RuleResult(PatternMatch match, ResolvedIntent intent) {}

    private final PatternMatcher patternMatcher;
    private final EntityExtractor entityExtractor;
    private final CrossPlatformMapper crossPlatformMapper;
    private final IntentCatalog catalog;
    private final SuggestionGenerator suggestionGenerator;
    private final GenerativeClassifier generativeClassifier;
    private final ExecutorService generativeExecutor;
    private final SwitchboardMetrics metrics;
    private final double genericThreshold;
    private final double crossPlatformThreshold;
    private final Duration generativeTimeout;

    @Autowired
    public HybridResolver(PatternMatcher patternMatcher,
                          EntityExtractor entityExtractor,
                          CrossPlatformMapper crossPlatformMapper,
                          IntentCatalog catalog,
                          SuggestionGenerator suggestionGenerator,
                          @Autowired(required = false) GenerativeClassifier generativeClassifier,
                          @Qualifier("generativeExecutor") ExecutorService generativeExecutor,
                          @Autowired(required = false) SwitchboardMetrics metrics,
                          SwitchboardProperties properties) {
        this(patternMatcher, entityExtractor, crossPlatformMapper, catalog, suggestionGenerator,
                generativeClassifier, generativeExecutor, metrics,
                properties.getGenericAcceptThreshold(),
                properties.getCrossPlatformAcceptThreshold(),
                properties.getGenerativeTimeout());
    }

    HybridResolver(PatternMatcher patternMatcher,
                   EntityExtractor entityExtractor,
                   CrossPlatformMapper crossPlatformMapper,
                   IntentCatalog catalog,
                   SuggestionGenerator suggestionGenerator,
                   GenerativeClassifier generativeClassifier,
                   ExecutorService generativeExecutor,
                   SwitchboardMetrics metrics,
                   double genericThreshold,
                   double crossPlatformThreshold,
                   Duration generativeTimeout) {
        this.patternMatcher = patternMatcher;
        this.entityExtractor = entityExtractor;
        this.crossPlatformMapper = crossPlatformMapper;
        this.catalog = catalog;
        this.suggestionGenerator = suggestionGenerator;
        this.generativeClassifier = generativeClassifier;
        this.generativeExecutor = generativeExecutor;
        this.metrics = metrics;
        this.genericThreshold = genericThreshold;
        this.crossPlatformThreshold = crossPlatformThreshold;
        this.generativeTimeout = generativeTimeout;
    }

    /**
     * @param context may be null
     * @param mode    null means {@link ResolutionMode#HYBRID}
     */
    public ResolvedIntent resolve(String message, ConversationContext context, ResolutionMode mode) {
        if (message == null || message.isBlank()) {
            return unknown(message);
        }
        ResolutionMode effectiveMode = mode == null ? ResolutionMode.HYBRID : mode;
        try {
            PlatformDetection detection = PlatformDetector.detect(message);
            ResolvedIntent decided = switch (effectiveMode) {
                case RULES -> ruleAttempt(message, detection)
                        .map(r -> r.intent().withResolutionPath(ResolutionPath.RULES))
                        .orElseGet(() -> unknown(message));
                case GENERATIVE -> generativeAttempt(message, context)
                        .map(GenerativeResponse::toResolvedIntent)
                        .orElseGet(() -> unknown(message));
                case HYBRID -> hybrid(message, context, detection);
            };
            if (decided.isUnknown()) {
                return decided;
            }
            return completeFollowUps(applyCrossPlatformMapping(decided, detection), context);
        } catch (RuntimeException e) {
            log.error("Intent resolution failed, returning unknown: {}", e.getMessage(), e);
            return unknown(message);
        }
    }

    private ResolvedIntent hybrid(String message, ConversationContext context, PlatformDetection detection) {
        Optional<RuleResult> rule = ruleAttempt(message, detection);
        if (rule.isPresent() && rule.get().match().confidence() >= thresholdFor(rule.get().match())) {
            log.debug("Rule match {} accepted at {}", rule.get().match().intent(), rule.get().match().confidence());
            return rule.get().intent().withResolutionPath(ResolutionPath.RULES_PRIORITY);
        }

        Optional<GenerativeResponse> generative = generativeAttempt(message, context);
        if (generative.isPresent()) {
            return rule.map(r -> IntentMerger.merge(r.intent(), generative.get()))
                    .orElseGet(() -> generative.get().toResolvedIntent());
        }
        return rule.map(r -> r.intent().withResolutionPath(ResolutionPath.RULES_FALLBACK))
                .orElseGet(() -> unknown(message));
    }

    private double thresholdFor(PatternMatch match) {
        return match.crossPlatform() ? crossPlatformThreshold : genericThreshold;
    }

    private Optional<RuleResult> ruleAttempt(String message, PlatformDetection detection) {
        return patternMatcher.match(message).map(match -> new RuleResult(match, compose(message, match, detection)));
    }

    private ResolvedIntent compose(String message, PatternMatch match, PlatformDetection detection) {
        IntentDefinition definition = match.definition();
        Map<String, Object> entities = entityExtractor.extractAll(message, definition.entities());
        List<String> platforms = detection.platforms().isEmpty() && match.crossPlatform()
                ? definition.platforms()
                : detection.platforms();
        return new ResolvedIntent(
                definition.name(),
                match.confidence(),
                entities,
                definition.action(),
                entities,
                definition.workflow(),
                platforms,
                match.crossPlatform() || detection.crossPlatformRequested(),
                definition.dataIntegration(),
                definition.requiresConfirmation(),
                List.of(),
                ResolutionPath.RULES.tag());
    }

    /**
     * Calls the classifier on the generative executor and waits at most the
     * configured timeout. The call runs with the caller's MDC. A timeout or an
     * interrupt of the calling thread cancels the call.
     */
    private Optional<GenerativeResponse> generativeAttempt(String message, ConversationContext context) {
        if (generativeClassifier == null) {
            log.debug("No generative classifier configured");
            return Optional.empty();
        }
        GenerativeRequest request = new GenerativeRequest(
                message,
                PlatformCatalog.all(),
                crossPlatformMapper.patterns(),
                context == null ? null : context.userPreferences(),
                context == null ? null : context.platformContext(),
                catalog.snapshot());

        Future<GenerativeResponse> future;
        try {
            future = generativeExecutor.submit(MdcContext.propagate(() -> generativeClassifier.classify(request)));
        } catch (RejectedExecutionException e) {
            log.warn("Generative classifier unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(future.get(generativeTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generative classifier timed out after {} ms", generativeTimeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the generative classifier");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Generative classifier failed: {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
        }
        return Optional.empty();
    }

    private ResolvedIntent applyCrossPlatformMapping(ResolvedIntent resolved, PlatformDetection detection) {
        if (resolved.dataIntegration() != null) {
            return resolved;
        }
        Optional<DataIntegrationPlan> plan = crossPlatformMapper.match(detection.platforms());
        if (plan.isEmpty()) {
            return resolved;
        }
        var platforms = new LinkedHashSet<>(resolved.platforms());
        platforms.addAll(plan.get().allPlatforms());
        log.debug("Integration pattern {} attached to {}", plan.get().key(), resolved.intent());
        return resolved.withDataIntegration(plan.get(), List.copyOf(platforms));
    }

    private ResolvedIntent completeFollowUps(ResolvedIntent resolved, ConversationContext context) {
        IntentDefinition definition = catalog.find(resolved.intent()).orElse(null);
        SuggestionGenerator.Suggestions suggestions = suggestionGenerator.complete(resolved, definition, context);
        if (metrics != null) {
            metrics.recordInsights(suggestions.insightCount());
        }
        return resolved.withSuggestedResponses(suggestions.responses());
    }

    /**
     * The terminal fallback result.
     */
    public static ResolvedIntent unknown(String message) {
        return new ResolvedIntent(
                ResolvedIntent.UNKNOWN_INTENT,
                UNKNOWN_CONFIDENCE,
                Map.of(),
                "respond",
                Map.of("message", message == null ? "" : message),
                null,
                List.of(),
                false,
                null,
                false,
                UNKNOWN_FOLLOW_UPS,
                ResolutionPath.FALLBACK.tag());
    }
}
