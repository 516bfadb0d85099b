package com.sahayak.dispatch.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Exposes the agent socket. Authentication and connection-rate checks run in
 * {@link TokenHandshakeInterceptor} before the upgrade is accepted.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AgentWebSocketHandler agentWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
    private final WebSocketProperties properties;

    public WebSocketConfig(AgentWebSocketHandler agentWebSocketHandler,
                           TokenHandshakeInterceptor tokenHandshakeInterceptor,
                           WebSocketProperties properties) {
        this.agentWebSocketHandler = agentWebSocketHandler;
        this.tokenHandshakeInterceptor = tokenHandshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(agentWebSocketHandler, properties.getPath())
                .addInterceptors(tokenHandshakeInterceptor)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(properties.getMaxBinaryMessageBytes());
        return container;
    }
}
