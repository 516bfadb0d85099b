package com.sahayak.core.speech;

/**
 * Thrown when the text-to-speech call fails or times out.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
