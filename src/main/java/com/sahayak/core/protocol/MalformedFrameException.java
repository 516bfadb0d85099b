package com.sahayak.core.protocol;

/**
 * Thrown when an inbound text frame cannot be decoded: invalid JSON, a missing
 * or unknown {@code type}, or a payload that does not fit its type.
 */
public class MalformedFrameException extends RuntimeException {

    public static final String MALFORMED_FRAME = "MALFORMED_FRAME";
    public static final String UNKNOWN_TYPE = "UNKNOWN_TYPE";

    private final String code;

    public MalformedFrameException(String code, String message) {
        super(message);
        this.code = code;
    }

    public MalformedFrameException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
