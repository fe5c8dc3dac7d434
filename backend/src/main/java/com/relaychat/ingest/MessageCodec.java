package com.relaychat.ingest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaychat.model.ChatMessage;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * JSON frames of the relay protocol: {@code {"date", "username", "message"}}.
 */
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes an inbound frame. Any client-supplied {@code date} is ignored in
     * favour of {@code arrivedAt}.
     *
     * @throws MalformedMessageException if the frame is not a JSON object or
     *                                   username/message is missing or empty
     */
    public ChatMessage decode(String frame, Instant arrivedAt) throws MalformedMessageException {
        InboundFrame inbound;
        try {
            inbound = objectMapper.readValue(frame, InboundFrame.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Frame is not a message object: " + e.getOriginalMessage(), e);
        }
        if (inbound == null) {
            throw new MalformedMessageException("Frame is empty");
        }
        ChatMessage message = new ChatMessage(arrivedAt, inbound.username(), inbound.message());
        if (!message.isComplete()) {
            throw new MalformedMessageException("Frame is missing username or message");
        }
        return message;
    }

    public String encode(ChatMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode message from '" + message.getUsername() + "'", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InboundFrame(String username, String message) {}
}
