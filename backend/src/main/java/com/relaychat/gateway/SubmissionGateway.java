package com.relaychat.gateway;

import com.relaychat.ingest.MessageCodec;
import com.relaychat.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Forwards a form submission into the relay the same way any client would: it
 * connects to the relay endpoint, sends one frame and disconnects.
 */
@Service
public class SubmissionGateway {

    private static final Logger log = LoggerFactory.getLogger(SubmissionGateway.class);

    private final WebSocketClient client;
    private final MessageCodec codec;
    private final Clock clock;
    private final String targetUri;
    private final long connectTimeoutMillis;

    public SubmissionGateway(WebSocketClient client,
                             MessageCodec codec,
                             Clock clock,
                             @Value("${relay.gateway.target-uri:ws://localhost:8080/ws}") String targetUri,
                             @Value("${relay.gateway.connect-timeout-ms:5000}") long connectTimeoutMillis) {
        this.client = client;
        this.codec = codec;
        this.clock = clock;
        this.targetUri = targetUri;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    /**
     * @return true once the frame has been handed to the relay
     */
    public boolean forward(String username, String message) {
        String frame = codec.encode(new ChatMessage(clock.instant(), username, message));
        CompletableFuture<WebSocketSession> handshake = client.execute(new AbstractWebSocketHandler() {}, targetUri);
        WebSocketSession session = null;
        try {
            session = handshake.get(connectTimeoutMillis, TimeUnit.MILLISECONDS);
            session.sendMessage(new TextMessage(frame));
            return true;
        } catch (ExecutionException e) {
            log.error("Could not connect to relay at {}: {}", targetUri, e.getCause().getMessage());
            return false;
        } catch (TimeoutException e) {
            handshake.cancel(true);
            log.error("Timed out connecting to relay at {}", targetUri);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while forwarding message from '{}'", username);
            return false;
        } catch (IOException e) {
            log.error("Failed to send message from '{}' to relay at {}", username, targetUri, e);
            return false;
        } finally {
            if (session != null) {
                closeQuietly(session);
            }
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Error closing gateway session {}: {}", session.getId(), e.getMessage());
        }
    }
}
