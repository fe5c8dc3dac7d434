package com.relaychat.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaychat.model.ChatMessage;
import com.relaychat.support.TestJson;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MessageCodecTest {

    private static final Instant ARRIVED = Instant.parse("2024-05-01T12:00:00.125Z");

    private final ObjectMapper objectMapper = TestJson.objectMapper();
    private final MessageCodec codec = new MessageCodec(objectMapper);

    @Test
    void decodeStampsArrivalTimeAndIgnoresClientDate() throws Exception {
        ChatMessage message = codec.decode(
                "{\"date\": \"2001-01-01T00:00:00.000001\", \"username\": \"alice\", \"message\": \"hi\"}",
                ARRIVED);

        assertEquals(ARRIVED, message.getDate());
        assertEquals("alice", message.getUsername());
        assertEquals("hi", message.getMessage());
        assertNull(message.getId());
    }

    @Test
    void decodeIgnoresUnknownFields() throws Exception {
        ChatMessage message = codec.decode(
                "{\"username\": \"alice\", \"message\": \"hi\", \"_id\": \"65f0\", \"room\": \"lobby\"}", ARRIVED);

        assertEquals("alice", message.getUsername());
    }

    @Test
    void whitespaceOnlyFieldsArePresent() throws Exception {
        ChatMessage message = codec.decode("{\"username\": \" \", \"message\": \"   \"}", ARRIVED);

        assertEquals(" ", message.getUsername());
        assertEquals("   ", message.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json",
            "null",
            "[1, 2]",
            "{}",
            "{\"username\": \"alice\"}",
            "{\"message\": \"hi\"}",
            "{\"username\": \"\", \"message\": \"hi\"}",
            "{\"username\": \"alice\", \"message\": \"\"}",
            "{\"username\": \"alice\", \"message\": null}",
            "{\"username\": {\"first\": \"alice\"}, \"message\": \"hi\"}"
    })
    void incompleteOrUndecodableFramesAreMalformed(String frame) {
        assertThrows(MalformedMessageException.class, () -> codec.decode(frame, ARRIVED));
    }

    @Test
    void encodeWritesWireFieldsOnly() throws Exception {
        ChatMessage stored = new ChatMessage(9L, ARRIVED, "alice", "hi");

        JsonNode frame = objectMapper.readTree(codec.encode(stored));

        assertEquals("2024-05-01T12:00:00.125Z", frame.get("date").asText());
        assertEquals("alice", frame.get("username").asText());
        assertEquals("hi", frame.get("message").asText());
        assertFalse(frame.has("id"));
        assertFalse(frame.has("complete"));
        assertEquals(3, frame.size());
    }
}
