package com.sahayak.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads inbound envelopes and writes outbound frames as JSON text.
 */
@Component
public class ProtocolCodec {

    private final ObjectMapper objectMapper;

    public ProtocolCodec() {
        this.objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    public InboundMessage decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException(MalformedFrameException.MALFORMED_FRAME,
                    "Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException(MalformedFrameException.MALFORMED_FRAME,
                    "Frame must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedFrameException(MalformedFrameException.MALFORMED_FRAME,
                    "Frame has no type");
        }
        MessageType type = MessageType.fromWire(typeNode.asText())
                .orElseThrow(() -> new MalformedFrameException(MalformedFrameException.UNKNOWN_TYPE,
                        "Unknown frame type: " + typeNode.asText()));
        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        } else if (!payload.isObject()) {
            throw new MalformedFrameException(MalformedFrameException.MALFORMED_FRAME,
                    "Payload of " + type + " must be a JSON object");
        }
        return new InboundMessage(type, payload);
    }

    public <T> T readPayload(InboundMessage message, Class<T> payloadType) {
        try {
            return objectMapper.treeToValue(message.payload(), payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedFrameException(MalformedFrameException.MALFORMED_FRAME,
                    "Invalid " + message.type() + " payload: " + e.getMessage(), e);
        }
    }

    public String encode(OutboundFrame frame) throws IOException {
        return objectMapper.writeValueAsString(frame);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
