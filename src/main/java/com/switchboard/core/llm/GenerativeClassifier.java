package com.switchboard.core.llm;

/**
 * External generative intent classification capability.
 * <p>
 * Implementations may block and may fail in any way; callers bound the call
 * with a timeout and treat every exception as "no generative result".
 */
public interface GenerativeClassifier {

    /**
     * @throws LlmParseException         when the reply is malformed or fails validation
     * @throws LlmEmptyResponseException when the reply is empty
     */
    GenerativeResponse classify(GenerativeRequest request);
}
