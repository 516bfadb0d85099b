package com.sahayak.core.session;

import com.sahayak.core.protocol.OutboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one live connection per user id.
 * <p>
 * Registering a second connection for the same user replaces the first and
 * closes it with {@link DisconnectReason#REPLACED}. A displaced session's late
 * close must go through {@link #unregister(String, ClientConnection)} so it
 * cannot evict its replacement.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    public void register(String userId, ClientConnection connection) {
        ClientConnection previous = connections.put(userId, connection);
        if (previous != null && previous != connection) {
            log.info("User {} reconnected; closing previous connection {}", userId, previous.id());
            previous.close(DisconnectReason.REPLACED);
        }
        log.debug("Registered connection {} for user {} ({} active)", connection.id(), userId, connections.size());
    }

    public void unregister(String userId) {
        if (connections.remove(userId) != null) {
            log.debug("Unregistered user {}", userId);
        }
    }

    /**
     * Removes the mapping only if it still points at {@code connection}.
     *
     * @return true when the mapping was removed
     */
    public boolean unregister(String userId, ClientConnection connection) {
        boolean removed = connections.remove(userId, connection);
        if (removed) {
            log.debug("Unregistered connection {} for user {}", connection.id(), userId);
        }
        return removed;
    }

    public Optional<ClientConnection> connectionFor(String userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    /**
     * Sends to the user's current connection. Does nothing when the user is not connected.
     */
    public void send(String userId, OutboundFrame frame) {
        ClientConnection connection = connections.get(userId);
        if (connection == null) {
            log.debug("No connection for user {}; dropping {} frame", userId, frame.type());
            return;
        }
        try {
            connection.send(frame);
        } catch (IOException e) {
            log.warn("Failed to send {} to user {}: {}", frame.type(), userId, e.getMessage());
        }
    }

    /**
     * Best-effort delivery to every registered connection.
     *
     * @return number of connections the frame was delivered to
     */
    public int broadcast(OutboundFrame frame) {
        int delivered = 0;
        for (ClientConnection connection : List.copyOf(connections.values())) {
            try {
                connection.send(frame);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Broadcast of {} to user {} failed: {}", frame.type(), connection.userId(), e.getMessage());
            }
        }
        return delivered;
    }

    public boolean isConnected(String userId) {
        return connections.containsKey(userId);
    }

    public int activeCount() {
        return connections.size();
    }
}
