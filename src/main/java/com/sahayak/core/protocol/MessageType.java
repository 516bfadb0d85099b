package com.sahayak.core.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * Frame types exchanged over the agent WebSocket.
 */
public enum MessageType {

    // inbound
    CONTEXT_UPDATE,
    EXECUTION_RESULT,
    AUDIO_END,
    TEXT_COMMAND,
    AUDIO_CHUNK_BASE64,

    // outbound
    AGENT_SPEAK,
    ACTION_DISPATCH,
    ERROR;

    public boolean isInbound() {
        return ordinal() <= AUDIO_CHUNK_BASE64.ordinal();
    }

    /**
     * Resolves an inbound wire name. Outbound-only names are treated as unknown.
     */
    public static Optional<MessageType> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(MessageType::isInbound)
                .filter(type -> type.name().equals(name))
                .findFirst();
    }
}
