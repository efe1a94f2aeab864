package com.switchboard.core.llm;

/**
 * Thrown when model output cannot be parsed into the expected type, or parses
 * but fails validation.
 */
public class LlmParseException extends RuntimeException {
    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
