package com.sahayak.core.speech;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Client for the Deepgram pre-recorded transcription API.
 * <p>
 * The whole utterance is posted in one request once recording ends. The
 * container format is sniffed from the payload so the request carries a
 * matching {@code Content-Type}.
 */
@Service
public class TranscriptionClient {

    private static final Logger log = LoggerFactory.getLogger(TranscriptionClient.class);

    private final SpeechProperties.Deepgram properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public TranscriptionClient(SpeechProperties speechProperties) {
        this(speechProperties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    TranscriptionClient(SpeechProperties speechProperties, HttpClient httpClient) {
        this.properties = speechProperties.getDeepgram();
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
    }

    public boolean isConfigured() {
        return properties.hasApiKey();
    }

    /**
     * Transcribes one utterance.
     *
     * @param audio    the complete recording
     * @param language BCP-47 language hint, e.g. {@code en}
     * @return the transcript, or empty when the service heard nothing
     * @throws TranscriptionException when the service is not configured or the call fails
     */
    public Optional<String> transcribe(byte[] audio, String language) {
        if (!isConfigured()) {
            throw new TranscriptionException("Deepgram API key is not configured");
        }
        AudioFormat format = AudioFormat.detect(audio);
        String encoding = AudioFormat.encodingHint(audio);
        log.debug("Transcribing {} bytes as {}{}", audio.length, format.mimeType(),
                encoding != null ? " (" + encoding + ")" : "");

        var request = HttpRequest.newBuilder()
                .uri(URI.create(listenUrl(language, encoding)))
                .header("Authorization", "Token " + properties.getApiKey())
                .header("Content-Type", format.mimeType())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofByteArray(audio))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TranscriptionException("Deepgram request timed out after "
                    + properties.getTimeoutSeconds() + "s", e);
        } catch (IOException e) {
            throw new TranscriptionException("Deepgram request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Deepgram request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new TranscriptionException("Deepgram API error (HTTP %d): %s"
                    .formatted(response.statusCode(), response.body()));
        }
        return extractTranscript(response.body());
    }

    private Optional<String> extractTranscript(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TranscriptionException("Deepgram returned unreadable JSON", e);
        }
        JsonNode alternative = root.path("results").path("channels").path(0).path("alternatives").path(0);
        String transcript = alternative.path("transcript").asText("");
        if (transcript.isBlank()) {
            log.warn("No transcript in Deepgram response");
            return Optional.empty();
        }
        log.info("Transcript: '{}' (confidence: {})", transcript,
                String.format("%.2f", alternative.path("confidence").asDouble(0)));
        return Optional.of(transcript.trim());
    }

    private String listenUrl(String language, String encoding) {
        var url = new StringBuilder(trimTrailingSlash(properties.getBaseUrl()))
                .append("/v1/listen?model=").append(encode(properties.getModel()))
                .append("&language=").append(encode(language == null || language.isBlank() ? "en" : language))
                .append("&punctuate=true&smart_format=true");
        if (encoding != null) {
            url.append("&encoding=").append(encode(encoding));
        }
        return url.toString();
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
