package com.sahayak.core.llm;

/**
 * The chat completion succeeded with null or blank content.
 */
public class LlmEmptyResponseException extends LlmException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
