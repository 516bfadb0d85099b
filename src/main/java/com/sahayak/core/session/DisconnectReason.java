package com.sahayak.core.session;

/**
 * Why the server closes a connection, with the WebSocket close code sent to the client.
 */
public enum DisconnectReason {
    NORMAL(1000, "Normal closure"),
    POLICY_VIOLATION(1008, "Authentication required"),
    SERVER_ERROR(1011, "Internal error"),
    REPLACED(4000, "Replaced by a newer connection");

    private final int code;
    private final String description;

    DisconnectReason(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
