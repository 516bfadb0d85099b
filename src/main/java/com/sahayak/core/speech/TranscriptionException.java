package com.sahayak.core.speech;

/**
 * Thrown when the speech-to-text call fails or times out.
 */
public class TranscriptionException extends RuntimeException {

    public TranscriptionException(String message) {
        super(message);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
