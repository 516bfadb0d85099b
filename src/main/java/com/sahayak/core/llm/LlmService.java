package com.sahayak.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper over Spring AI's {@link ChatClient} for single-turn
 * system + user prompts that return raw text.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        log.info("LlmService initialized, OpenAI-compatible base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt and returns the model's text content.
     *
     * @throws LlmEmptyResponseException when the model returns blank content
     * @throws LlmException              when the call itself fails or times out
     */
    public String call(String systemPrompt, String userPrompt) {
        log.debug("LLM call started");
        long start = System.currentTimeMillis();
        String response;
        try {
            response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmException("LLM call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content."
                    + " Check that the model is reachable and the API key is valid.");
        }
        return response;
    }
}
