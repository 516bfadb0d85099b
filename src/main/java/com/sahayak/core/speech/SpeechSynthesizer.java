package com.sahayak.core.speech;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Client for the ElevenLabs text-to-speech API. Returns MP3 audio.
 */
@Service
public class SpeechSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SpeechSynthesizer.class);

    private final SpeechProperties.ElevenLabs properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public SpeechSynthesizer(SpeechProperties speechProperties) {
        this(speechProperties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    SpeechSynthesizer(SpeechProperties speechProperties, HttpClient httpClient) {
        this.properties = speechProperties.getElevenlabs();
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    public String voiceId() {
        return properties.getVoiceId();
    }

    /**
     * @return MP3 bytes, or empty when the text is blank, no key is configured,
     *         or the service returned no audio
     * @throws SynthesisException when the upstream call fails
     */
    public Optional<byte[]> synthesize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        if (!isConfigured()) {
            log.debug("ElevenLabs API key not configured; skipping synthesis");
            return Optional.empty();
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.put("text", text);
        body.put("model_id", properties.getModelId());

        var request = HttpRequest.newBuilder()
                .uri(URI.create(TranscriptionClient.trimTrailingSlash(properties.getBaseUrl())
                        + "/v1/text-to-speech/" + properties.getVoiceId()))
                .header("xi-api-key", properties.getApiKey())
                .header("Content-Type", "application/json")
                .header("Accept", "audio/mpeg")
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new SynthesisException("ElevenLabs request timed out after "
                    + properties.getTimeoutSeconds() + "s", e);
        } catch (IOException e) {
            throw new SynthesisException("ElevenLabs request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("ElevenLabs request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new SynthesisException("ElevenLabs API error (HTTP %d): %s"
                    .formatted(response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
        }
        byte[] audio = response.body();
        if (audio == null || audio.length == 0) {
            log.warn("ElevenLabs returned empty audio");
            return Optional.empty();
        }
        log.debug("Synthesized {} bytes for '{}'", audio.length, abbreviate(text));
        return Optional.of(audio);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
