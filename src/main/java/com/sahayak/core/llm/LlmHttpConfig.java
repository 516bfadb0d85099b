package com.sahayak.core.llm;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Bounds every chat-model HTTP call. Spring AI builds its OpenAI client from the
 * auto-configured {@code RestClient.Builder}, which applies this customizer.
 */
@Configuration
public class LlmHttpConfig {

    @Bean
    public RestClientCustomizer llmTimeoutCustomizer(LlmProperties properties) {
        return builder -> {
            var httpClient = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(10))
                    .build();
            var requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()));
            builder.requestFactory(requestFactory);
        };
    }
}
