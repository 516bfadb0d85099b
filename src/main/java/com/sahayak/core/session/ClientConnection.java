package com.sahayak.core.session;

import com.sahayak.core.protocol.OutboundFrame;

import java.io.IOException;
import java.time.Instant;

/**
 * Transport handle for one live client session. Implementations must allow
 * {@link #send} from any thread.
 */
public interface ClientConnection {

    String id();

    String userId();

    Instant connectedAt();

    boolean isOpen();

    void send(OutboundFrame frame) throws IOException;

    /**
     * Closes the transport. Closing an already-closed connection is a no-op.
     */
    void close(DisconnectReason reason);
}
