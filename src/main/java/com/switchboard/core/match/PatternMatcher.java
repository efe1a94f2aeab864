package com.switchboard.core.match;

import com.switchboard.core.catalog.IntentCatalog;
import com.switchboard.core.model.IntentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Substring-based intent matcher over the active {@link IntentCatalog}.
 * <p>
 * Two passes over one catalog snapshot: cross-platform definitions first at
 * {@value #CROSS_PLATFORM_CONFIDENCE}, then every definition at
 * {@value #GENERIC_CONFIDENCE}. Within a pass the first pattern that occurs in
 * the text wins, in catalog order and then pattern order; the longest match is
 * not preferred.
 */
@Component
public class PatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    public static final double CROSS_PLATFORM_CONFIDENCE = 0.85;
    public static final double GENERIC_CONFIDENCE = 0.7;

    private final IntentCatalog catalog;

    public PatternMatcher(IntentCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<PatternMatch> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        List<IntentDefinition> definitions = catalog.snapshot();

        for (IntentDefinition definition : definitions) {
            if (!definition.isCrossPlatformCandidate()) {
                continue;
            }
            Optional<String> pattern = firstMatchingPattern(definition, lowerText);
            if (pattern.isPresent()) {
                log.debug("Cross-platform pattern '{}' matched intent {}", pattern.get(), definition.name());
                return Optional.of(new PatternMatch(definition, CROSS_PLATFORM_CONFIDENCE, pattern.get(), true));
            }
        }

        for (IntentDefinition definition : definitions) {
            Optional<String> pattern = firstMatchingPattern(definition, lowerText);
            if (pattern.isPresent()) {
                log.debug("Pattern '{}' matched intent {}", pattern.get(), definition.name());
                return Optional.of(new PatternMatch(definition, GENERIC_CONFIDENCE, pattern.get(), false));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstMatchingPattern(IntentDefinition definition, String lowerText) {
        for (String pattern : definition.patterns()) {
            if (!pattern.isBlank() && lowerText.contains(pattern.toLowerCase(Locale.ROOT))) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
