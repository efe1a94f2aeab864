package com.switchboard.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.model.ConversationContext;
import com.switchboard.core.model.ResolutionMode;
import com.switchboard.core.model.ResolvedIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * TTL cache of resolved intents keyed by an MD5 digest of the message, the
 * resolution mode and the serialized conversation context.
 * <p>
 * Backed by Caffeine with expire-after-write and a ticker driven by the
 * injected {@link Clock}. The cache is unbounded.
 */
@Component
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, ResolvedIntent> cache;
    private final ObjectMapper keyMapper;

    @Autowired
    public ResponseCache(ObjectMapper objectMapper, Clock clock, SwitchboardProperties properties) {
        this(objectMapper, clock, properties.getCacheTtl());
    }

    ResponseCache(ObjectMapper objectMapper, Clock clock, Duration ttl) {
        this.keyMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(() -> toNanos(clock.instant()))
                .build();
        log.info("Response cache configured: ttl={}", ttl);
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    public String key(String message, ConversationContext context, ResolutionMode mode) {
        String serializedContext;
        try {
            serializedContext = context == null ? "{}" : keyMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Conversation context is not serializable: " + e.getMessage(), e);
        }
        String material = message + "\u0000" + mode.wireName() + "\u0000" + serializedContext;
        return DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<ResolvedIntent> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, ResolvedIntent value) {
        cache.put(key, value);
    }

    /** Live entries, after pending expirations have been applied. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
