package com.switchboard.core.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Ordered extraction rules for one entity type.
 * <p>
 * A single-valued chain returns the first non-empty capture, or the fallback's
 * value when no rule matches. A cumulative chain runs every rule over every
 * match and returns the distinct values in discovery order.
 */
public final class EntityRuleChain {

    private static final Pattern CONJUNCTION = Pattern.compile("\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private final List<ExtractionRule> rules;
    private final UnaryOperator<String> fallback;
    private final boolean cumulative;

    private EntityRuleChain(List<ExtractionRule> rules, UnaryOperator<String> fallback, boolean cumulative) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
        this.cumulative = cumulative;
    }

    public static EntityRuleChain firstMatch(List<ExtractionRule> rules) {
        return new EntityRuleChain(rules, text -> "", false);
    }

    public static EntityRuleChain firstMatch(List<ExtractionRule> rules, UnaryOperator<String> fallback) {
        return new EntityRuleChain(rules, fallback, false);
    }

    /**
     * Cumulative chain. Values joined by "and" are split into separate entries.
     */
    public static EntityRuleChain cumulative(List<ExtractionRule> rules) {
        return new EntityRuleChain(rules, text -> "", true);
    }

    /**
     * @return a {@code String} for single-valued chains, a {@code List<String>} for cumulative ones
     */
    public Object extract(String text) {
        return cumulative ? extractAll(text) : extractFirst(text);
    }

    String extractFirst(String text) {
        for (ExtractionRule rule : rules) {
            Optional<String> value = rule.apply(text);
            if (value.isPresent()) {
                return value.get();
            }
        }
        String fallbackValue = fallback.apply(text);
        return fallbackValue == null ? "" : fallbackValue.trim();
    }

    List<String> extractAll(String text) {
        var values = new ArrayList<String>();
        for (ExtractionRule rule : rules) {
            for (String match : rule.applyAll(text)) {
                for (String part : CONJUNCTION.split(match)) {
                    String value = part.trim();
                    if (value.startsWith("@")) {
                        value = value.substring(1);
                    }
                    if (!value.isEmpty() && !values.contains(value)) {
                        values.add(value);
                    }
                }
            }
        }
        return values;
    }
}
