package com.switchboard.core.match;

import com.switchboard.core.model.IntentDefinition;

/**
 * A rule hit: the matching definition, the baseline confidence of the pass that
 * found it and the pattern that fired.
 */
public record PatternMatch(
    IntentDefinition definition,
    double confidence,
    String matchedPattern,
    boolean crossPlatform
) {

    public String intent() {
        return definition.name();
    }
}
