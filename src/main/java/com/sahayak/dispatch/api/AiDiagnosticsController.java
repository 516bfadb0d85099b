package com.sahayak.dispatch.api;

import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.UserContext;
import com.sahayak.core.planner.PlanGenerator;
import com.sahayak.core.speech.SpeechProperties;
import com.sahayak.core.speech.SpeechSynthesizer;
import com.sahayak.core.speech.SynthesisException;
import com.sahayak.core.speech.TranscriptionClient;
import com.sahayak.core.llm.LlmProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manual probes for the external AI services. Useful when wiring credentials.
 */
@RestController
@RequestMapping("/api/v1/test-ai")
public class AiDiagnosticsController {

    private static final Logger log = LoggerFactory.getLogger(AiDiagnosticsController.class);
    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final TranscriptionClient transcriptionClient;
    private final PlanGenerator planGenerator;
    private final SpeechSynthesizer speechSynthesizer;
    private final SpeechProperties speechProperties;
    private final LlmProperties llmProperties;

    public AiDiagnosticsController(TranscriptionClient transcriptionClient,
                                   PlanGenerator planGenerator,
                                   SpeechSynthesizer speechSynthesizer,
                                   SpeechProperties speechProperties,
                                   LlmProperties llmProperties) {
        this.transcriptionClient = transcriptionClient;
        this.planGenerator = planGenerator;
        this.speechSynthesizer = speechSynthesizer;
        this.speechProperties = speechProperties;
        this.llmProperties = llmProperties;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> deepgram = new LinkedHashMap<>();
        deepgram.put("configured", transcriptionClient.isConfigured());
        deepgram.put("model", speechProperties.getDeepgram().getModel());
        deepgram.put("key_prefix", maskKey(speechProperties.getDeepgram().getApiKey()));
        result.put("deepgram", deepgram);

        Map<String, Object> llm = new LinkedHashMap<>();
        llm.put("configured", planGenerator.isConfigured());
        llm.put("provider", llmProperties.getProvider());
        llm.put("model", planGenerator.modelName());
        llm.put("key_prefix", maskKey(llmProperties.getApiKey()));
        result.put("llm", llm);

        Map<String, Object> elevenlabs = new LinkedHashMap<>();
        elevenlabs.put("configured", speechSynthesizer.isConfigured());
        elevenlabs.put("voice_id", speechSynthesizer.voiceId());
        elevenlabs.put("key_prefix", maskKey(speechProperties.getElevenlabs().getApiKey()));
        result.put("elevenlabs", elevenlabs);

        return result;
    }

    @PostMapping("/llm")
    public Map<String, Object> testLlm(@RequestBody CommandRequest request) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("command", request.text());
        try {
            ActionPlan plan = planGenerator.generate(request.text(), UserContext.at("/dashboard"));
            result.put("success", true);
            result.put("plan", plan);
        } catch (RuntimeException e) {
            log.info("Planner probe failed: {}", e.getMessage());
            result.put("success", false);
            result.put("error", e.getMessage());
            result.put("fallback_plan", planGenerator.createFallbackPlan(request.text()));
        }
        return result;
    }

    @PostMapping("/fallback-plan")
    public Map<String, Object> fallbackPlan(@RequestBody CommandRequest request) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("command", request.text());
        result.put("plan", planGenerator.createFallbackPlan(request.text()));
        return result;
    }

    @PostMapping("/tts")
    public ResponseEntity<?> testTts(@RequestBody CommandRequest request) {
        if (!speechSynthesizer.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Text-to-speech is not configured"));
        }
        try {
            return speechSynthesizer.synthesize(request.text())
                    .<ResponseEntity<?>>map(audio -> ResponseEntity.ok().contentType(AUDIO_MPEG).body(audio))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .body(Map.of("error", "No audio produced")));
        } catch (SynthesisException e) {
            log.warn("TTS probe failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }

    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "NOT SET";
        }
        return (key.length() > 8 ? key.substring(0, 8) : key) + "...";
    }

    public record CommandRequest(String text) {}
}
