package com.sahayak.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded inbound text frame: its type and the raw payload tree.
 */
public record InboundMessage(MessageType type, JsonNode payload) {
}
