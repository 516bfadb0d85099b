package com.sahayak.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Base64;

/**
 * Payload of an {@code AGENT_SPEAK} frame. {@code audio_base64} is always
 * written (null when the client should speak the text itself); the other
 * optional fields are omitted when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentSpeak(
    @JsonProperty("audio_base64") @JsonInclude(JsonInclude.Include.ALWAYS) String audioBase64,
    String text,
    @JsonProperty("mime_type") String mimeType,
    @JsonProperty("use_browser_tts") Boolean useBrowserTts
) {

    public static final String AUDIO_MPEG = "audio/mpeg";

    public static AgentSpeak withAudio(String text, byte[] audio) {
        return new AgentSpeak(Base64.getEncoder().encodeToString(audio), text, AUDIO_MPEG, null);
    }

    public static AgentSpeak textOnly(String text) {
        return new AgentSpeak(null, text, null, Boolean.TRUE);
    }

    public boolean hasAudio() {
        return audioBase64 != null;
    }
}
