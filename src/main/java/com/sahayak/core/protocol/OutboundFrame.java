package com.sahayak.core.protocol;

import com.sahayak.core.model.ActionPlan;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Envelope for frames sent to the client: {@code {type, payload}}.
 */
public record OutboundFrame(MessageType type, Object payload) {

    public static OutboundFrame agentSpeak(AgentSpeak speak) {
        return new OutboundFrame(MessageType.AGENT_SPEAK, speak);
    }

    public static OutboundFrame actionDispatch(ActionPlan plan) {
        return new OutboundFrame(MessageType.ACTION_DISPATCH, plan);
    }

    public static OutboundFrame error(String code, String message) {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message);
        return new OutboundFrame(MessageType.ERROR, payload);
    }
}
