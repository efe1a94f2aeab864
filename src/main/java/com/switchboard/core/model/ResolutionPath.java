package com.switchboard.core.model;

/**
 * Diagnostic tag recorded on every {@link ResolvedIntent}.
 */
public enum ResolutionPath {
    /** Explicit rules mode, pattern matched. */
    RULES("rules"),
    /** Generative response used as-is (explicit mode, or hybrid with no rule match). */
    GENERATIVE("generative"),
    /** Hybrid: rule confidence cleared the acceptance threshold. */
    RULES_PRIORITY("rules_priority"),
    /** Hybrid: rule and generative results merged. */
    AI_ENHANCED("ai_enhanced"),
    /** Hybrid: generative attempt failed, low-confidence rule result returned. */
    RULES_FALLBACK("rules_fallback"),
    /** Terminal "unknown" intent. */
    FALLBACK("fallback");

    private final String tag;

    ResolutionPath(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
