package com.relaychat.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One relayed chat message. The same shape travels on the wire, into the
 * JSON mirror and into the {@code messages} table; only the table carries the id.
 */
@Entity
@Table(name = "messages")
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "username", "message"})
public class ChatMessage {

    // Assigned by the primary store; never serialized.
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    // Server arrival time
    @Column(name = "sent_at", nullable = false)
    private Instant date;

    // Fields are opaque text of any length up to the frame limit
    @Lob
    @Column(nullable = false)
    private String username;

    @Lob
    @Column(nullable = false)
    private String message;

    public ChatMessage(Instant date, String username, String message) {
        this(null, date, username, message);
    }

    /**
     * Copy of this message without a storage id.
     */
    public ChatMessage detached() {
        return new ChatMessage(date, username, message);
    }

    /**
     * Both required fields are present and non-empty. Content is otherwise not inspected.
     */
    @JsonIgnore
    public boolean isComplete() {
        return username != null && !username.isEmpty()
                && message != null && !message.isEmpty();
    }
}
