package com.relaychat.ingest;

import com.relaychat.registry.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ClientConnection} over a Spring WebSocket session. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator}, which makes them thread-safe and
 * fails a send that contends with one already over the time or buffer limit.
 * The time spent in any single send is bounded by the broadcast deadline.
 */
class WebSocketClientConnection implements ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketClientConnection.class);

    private final WebSocketSession session;

    WebSocketClientConnection(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String frame) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Connection " + id() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException e) {
            throw new IOException("Connection " + id() + " exceeded its send limits", e);
        }
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", id(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketClientConnection[" + id() + "]";
    }
}
