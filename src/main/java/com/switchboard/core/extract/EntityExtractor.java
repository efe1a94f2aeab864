package com.switchboard.core.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts typed entity values from request text using the ordered rule chains
 * in {@link EntityRules}.
 * <p>
 * Extraction never fails: unknown entity types, blank input and rule errors all
 * produce an empty value.
 */
@Component
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private final Map<String, EntityRuleChain> chains;

    public EntityExtractor() {
        this(EntityRules.defaults());
    }

    EntityExtractor(Map<String, EntityRuleChain> chains) {
        this.chains = Map.copyOf(chains);
    }

    /**
     * Extracts a single entity.
     *
     * @return a {@code String}, a {@code List<String>} for participants, or {@code ""}
     */
    public Object extract(String text, String entityType) {
        if (text == null || text.isBlank() || entityType == null) {
            return "";
        }
        EntityRuleChain chain = chains.get(entityType);
        if (chain == null) {
            log.debug("No extraction rules for entity type '{}'", entityType);
            return "";
        }
        try {
            return chain.extract(text);
        } catch (RuntimeException e) {
            log.warn("Entity extraction failed for type '{}': {}", entityType, e.getMessage());
            return "";
        }
    }

    /**
     * Extracts every requested entity type, keeping request order and omitting
     * types that produced nothing.
     */
    public Map<String, Object> extractAll(String text, Collection<String> entityTypes) {
        var result = new LinkedHashMap<String, Object>();
        if (entityTypes == null) {
            return result;
        }
        for (String type : entityTypes) {
            Object value = extract(text, type);
            if (!isEmpty(value)) {
                result.put(type, value);
            }
        }
        return result;
    }

    public boolean supports(String entityType) {
        return chains.containsKey(entityType);
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isEmpty();
        }
        return value instanceof List<?> list && list.isEmpty();
    }
}
