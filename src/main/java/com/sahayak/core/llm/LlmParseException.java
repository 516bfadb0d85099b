package com.sahayak.core.llm;

/**
 * The model answered, but the answer is not a valid action plan.
 */
public class LlmParseException extends LlmException {

    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
