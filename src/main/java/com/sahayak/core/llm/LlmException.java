package com.sahayak.core.llm;

/**
 * Base exception for failed chat-model calls: transport errors, timeouts and
 * responses that cannot be turned into a usable result.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
