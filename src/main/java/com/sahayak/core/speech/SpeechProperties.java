package com.sahayak.core.speech;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Credentials and endpoints for the speech-to-text and text-to-speech services.
 */
@Component
@ConfigurationProperties(prefix = "sahayak.speech")
public class SpeechProperties {

    private Deepgram deepgram = new Deepgram();
    private ElevenLabs elevenlabs = new ElevenLabs();

    public Deepgram getDeepgram() {
        return deepgram;
    }

    public void setDeepgram(Deepgram deepgram) {
        this.deepgram = deepgram;
    }

    public ElevenLabs getElevenlabs() {
        return elevenlabs;
    }

    public void setElevenlabs(ElevenLabs elevenlabs) {
        this.elevenlabs = elevenlabs;
    }

    public static class Deepgram {
        private String apiKey = "";
        private String baseUrl = "https://api.deepgram.com";
        private String model = "nova-2";
        private int timeoutSeconds = 30;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class ElevenLabs {
        private String apiKey = "";
        private String baseUrl = "https://api.elevenlabs.io";
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String modelId = "eleven_multilingual_v2";
        private int timeoutSeconds = 15;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
