package com.sahayak.dispatch.ws;

import com.sahayak.core.protocol.OutboundFrame;
import com.sahayak.core.protocol.ProtocolCodec;
import com.sahayak.core.session.ClientConnection;
import com.sahayak.core.session.DisconnectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Instant;

/**
 * {@link ClientConnection} over a Spring WebSocket session. Sends are serialized
 * by {@link ConcurrentWebSocketSessionDecorator}, so any thread may send.
 */
public class WebSocketClientConnection implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    private final WebSocketSession session;
    private final String userId;
    private final ProtocolCodec codec;
    private final Instant connectedAt = Instant.now();

    public WebSocketClientConnection(WebSocketSession session, String userId, ProtocolCodec codec,
                                     int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        this.userId = userId;
        this.codec = codec;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public Instant connectedAt() {
        return connectedAt;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(OutboundFrame frame) throws IOException {
        session.sendMessage(new TextMessage(codec.encode(frame)));
    }

    @Override
    public void close(DisconnectReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(reason.code(), reason.description()));
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
