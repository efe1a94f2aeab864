package com.switchboard.core.engine;

import com.switchboard.core.cache.ResponseCache;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.ConversationContext;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolutionPath;
import com.switchboard.core.model.ResolvedIntent;
import com.switchboard.core.resolver.HybridResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for intent resolution.
 * <p>
 * Wraps {@link HybridResolver} with the response cache, request metrics and
 * conversation-context bookkeeping. Cache and metrics are updated once per
 * request, after the result is final and before it is returned.
 */
@Service
public class IntentEngine {

    private static final Logger log = LoggerFactory.getLogger(IntentEngine.class);
    private static final AtomicInteger REQUEST_COUNTER = new AtomicInteger(0);

    /**
     * A resolution together with the conversation context as it stands afterwards.
     */
    public record ContextualResolution(ResolvedIntent intent, ConversationContext context) {}

    private final HybridResolver resolver;
    private final ResponseCache cache;
    private final SwitchboardMetrics metrics;
    private final ExecutorService resolveExecutor;
    private final Clock clock;

    @Autowired
    public IntentEngine(HybridResolver resolver,
                        ResponseCache cache,
                        SwitchboardMetrics metrics,
                        @Qualifier("resolveExecutor") ExecutorService resolveExecutor,
                        Clock clock) {
        this.resolver = resolver;
        this.cache = cache;
        this.metrics = metrics;
        this.resolveExecutor = resolveExecutor;
        this.clock = clock;
    }

    public ResolvedIntent resolve(String message) {
        return resolve(message, null, ResolutionMode.HYBRID);
    }

    /**
     * Resolves a message. Never throws; the worst outcome is the {@code unknown} intent.
     *
     * @param context may be null
     * @param mode    null means {@link ResolutionMode#HYBRID}
     */
    public ResolvedIntent resolve(String message, ConversationContext context, ResolutionMode mode) {
        ResolutionMode effectiveMode = mode == null ? ResolutionMode.HYBRID : mode;
        String requestId = generateRequestId();
        MdcContext.setRequest(requestId, effectiveMode.wireName());
        if (context != null) {
            MdcContext.setSession(context.userId(), context.sessionId());
        }
        var completion = new RequestCompletion(effectiveMode, System.nanoTime());
        try {
            String key = cacheKey(message, context, effectiveMode);
            if (key != null) {
                var cached = cache.get(key);
                if (cached.isPresent()) {
                    log.debug("Cache hit for request {}: {}", requestId, cached.get().intent());
                    completion.complete(cached.get(), null, true);
                    return cached.get();
                }
            }
            ResolvedIntent result = resolver.resolve(message, context, effectiveMode);
            completion.complete(result, key, false);
            log.info("Request {} resolved to {} ({}, {})", requestId, result.intent(),
                    String.format("%.2f", result.confidence()), result.resolutionPath());
            return result;
        } catch (RuntimeException e) {
            log.error("Request {} failed unexpectedly: {}", requestId, e.getMessage(), e);
            ResolvedIntent fallback = HybridResolver.unknown(message);
            completion.complete(fallback, null, false);
            return fallback;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resolves a message and returns the updated conversation context alongside.
     * A null context starts a new anonymous session.
     */
    public ContextualResolution resolveInContext(String message, ConversationContext context, ResolutionMode mode) {
        ConversationContext current = context != null ? context : ConversationContext.newSession(null, null);
        ResolvedIntent result = resolve(message, current, mode);
        return new ContextualResolution(result, current.afterResolution(result, clock.instant()));
    }

    /**
     * Resolves the last message of a conversation transcript.
     *
     * @throws IllegalArgumentException when {@code messages} is empty
     */
    public ContextualResolution processConversation(List<String> messages, ConversationContext context,
                                                    ResolutionMode mode) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Conversation must contain at least one message");
        }
        return resolveInContext(messages.get(messages.size() - 1), context, mode);
    }

    /**
     * Resolves on the engine's executor. Cancelling the returned future
     * interrupts the resolution, which also cancels any pending classifier call.
     */
    public Future<ResolvedIntent> resolveAsync(String message, ConversationContext context, ResolutionMode mode) {
        return resolveExecutor.submit(() -> resolve(message, context, mode));
    }

    private String cacheKey(String message, ConversationContext context, ResolutionMode mode) {
        if (message == null || message.isBlank()) {
            return null;
        }
        try {
            return cache.key(message, context, mode);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping response cache: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Generates a request ID in the format SWB-YYYY-NNNNNN.
     */
    String generateRequestId() {
        int count = REQUEST_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("SWB-%d-%06d", year, count);
    }

    /**
     * Per-request side channels, applied at most once.
     */
    private final class RequestCompletion {

        private final AtomicBoolean done = new AtomicBoolean();
        private final ResolutionMode mode;
        private final long startNanos;

        RequestCompletion(ResolutionMode mode, long startNanos) {
            this.mode = mode;
            this.startNanos = startNanos;
        }

        /**
         * @param cacheKey key to store the result under, or null to skip caching
         */
        void complete(ResolvedIntent result, String cacheKey, boolean cacheHit) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            if (cacheKey != null && !ResolutionPath.FALLBACK.tag().equals(result.resolutionPath())) {
                cache.put(cacheKey, result);
            }
            metrics.recordRequest(result, mode, elapsedMs, cacheHit);
        }
    }
}
