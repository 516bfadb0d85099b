package com.sahayak.dispatch.ws;

import com.sahayak.core.engine.AgentOrchestrator;
import com.sahayak.core.protocol.ProtocolCodec;
import com.sahayak.core.session.ClientConnection;
import com.sahayak.core.session.DisconnectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.ByteBuffer;

/**
 * Adapts Spring WebSocket callbacks to the {@link AgentOrchestrator}. Binary
 * frames are audio chunks; text frames are JSON envelopes.
 */
@Component
public class AgentWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AgentWebSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = "sahayak.connection";

    private final AgentOrchestrator orchestrator;
    private final ProtocolCodec codec;
    private final WebSocketProperties properties;

    public AgentWebSocketHandler(AgentOrchestrator orchestrator, ProtocolCodec codec,
                                 WebSocketProperties properties) {
        this.orchestrator = orchestrator;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object userId = session.getAttributes().get(TokenHandshakeInterceptor.USER_ID_ATTRIBUTE);
        if (!(userId instanceof String user) || user.isBlank()) {
            log.warn("WebSocket session {} without authenticated user", session.getId());
            session.close(new CloseStatus(DisconnectReason.POLICY_VIOLATION.code(),
                    DisconnectReason.POLICY_VIOLATION.description()));
            return;
        }
        var connection = new WebSocketClientConnection(session, user, codec,
                properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        orchestrator.onConnect(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = connectionOf(session);
        if (connection != null) {
            orchestrator.onTextFrame(connection, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ClientConnection connection = connectionOf(session);
        if (connection != null) {
            ByteBuffer payload = message.getPayload();
            byte[] chunk = new byte[payload.remaining()];
            payload.get(chunk);
            orchestrator.onAudioChunk(connection, chunk);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ClientConnection connection = connectionOf(session);
        if (connection != null) {
            orchestrator.onTransportError(connection, exception);
        } else {
            log.warn("Transport error on unregistered session {}: {}", session.getId(), exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = connectionOf(session);
        if (connection != null) {
            log.debug("Session {} closed with {}", session.getId(), status);
            orchestrator.onDisconnect(connection);
        }
    }

    private static ClientConnection connectionOf(WebSocketSession session) {
        return (ClientConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
