package com.relaychat.ingest;

import com.relaychat.broadcast.BroadcastCoordinator;
import com.relaychat.model.ChatMessage;
import com.relaychat.registry.ClientConnection;
import com.relaychat.registry.ConnectionRegistry;
import jakarta.websocket.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.time.Instant;

/**
 * Receive side of the relay endpoint. Each session is registered once its
 * handshake completes and removed when its transport closes or fails; every
 * text frame in between is decoded and handed to the {@link BroadcastCoordinator}.
 * Malformed frames are dropped without closing the connection.
 */
@Component
public class MessageIngest extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageIngest.class);

    static final String CONNECTION_ATTRIBUTE = MessageIngest.class.getName() + ".connection";

    // Tomcat blocks a send for up to 20 s by default unless this user property is set
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final ConnectionRegistry registry;
    private final BroadcastCoordinator coordinator;
    private final MessageCodec codec;
    private final Clock clock;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimit;

    public MessageIngest(ConnectionRegistry registry,
                         BroadcastCoordinator coordinator,
                         MessageCodec codec,
                         Clock clock,
                         @Value("${relay.broadcast.send-time-limit-ms:5000}") int sendTimeLimitMillis,
                         @Value("${relay.broadcast.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.registry = registry;
        this.coordinator = coordinator;
        this.codec = codec;
        this.clock = clock;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        limitBlockingSends(session);
        ClientConnection connection = new WebSocketClientConnection(session, sendTimeLimitMillis, bufferSizeLimit);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        registry.add(connection);
        log.info("Client {} connected from {} ({} live)", session.getId(), session.getRemoteAddress(), registry.size());
    }

    private void limitBlockingSends(WebSocketSession session) {
        if (session instanceof NativeWebSocketSession nativeSession) {
            Session endpoint = nativeSession.getNativeSession(Session.class);
            if (endpoint != null) {
                endpoint.getUserProperties().put(BLOCKING_SEND_TIMEOUT, (long) sendTimeLimitMillis);
            }
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage frame) {
        Instant arrivedAt = clock.instant();
        ChatMessage message;
        try {
            message = codec.decode(frame.getPayload(), arrivedAt);
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed frame from client {}: {}", session.getId(), e.getMessage());
            return;
        }
        coordinator.publish(message);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage frame) {
        log.warn("Dropping binary frame ({} bytes) from client {}", frame.getPayloadLength(), session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on client {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    private void release(WebSocketSession session) {
        Object handle = session.getAttributes().get(CONNECTION_ATTRIBUTE);
        if (!(handle instanceof ClientConnection connection)) {
            return;
        }
        if (registry.remove(connection)) {
            log.info("Client {} disconnected ({} live)", session.getId(), registry.size());
        }
        connection.close();
    }
}
