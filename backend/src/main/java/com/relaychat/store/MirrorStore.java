package com.relaychat.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaychat.model.ChatMessage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flat-file JSON copy of the message history.
 * <p>
 * The file holds a single pretty-printed array of {@code {date, username, message}}
 * records and is rewritten in full on every append. Appends are serialized by one
 * writer lock; each rewrite goes to a temporary sibling that is then moved over the
 * artifact, so readers always see a complete array. A missing or unparsable artifact
 * reads as an empty history and is replaced by the next successful append.
 */
@Component
public class MirrorStore {

    private static final Logger log = LoggerFactory.getLogger(MirrorStore.class);

    private static final TypeReference<List<ChatMessage>> HISTORY = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public MirrorStore(@Value("${relay.mirror.path:storage/data.json}") String path,
                       ObjectMapper objectMapper) {
        this.path = Path.of(path);
        this.objectMapper = objectMapper;
    }

    /**
     * Creates the parent directory and an empty array if no artifact exists yet.
     */
    @PostConstruct
    public void initialize() {
        writeLock.lock();
        try {
            if (Files.notExists(path)) {
                write(new ArrayList<>());
                log.info("Created empty message mirror at {}", path.toAbsolutePath());
            }
        } catch (IOException e) {
            log.error("Could not create message mirror at {}", path.toAbsolutePath(), e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Full history in append order; empty if the artifact is missing or corrupt.
     */
    public List<ChatMessage> load() {
        if (Files.notExists(path)) {
            return new ArrayList<>();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || !root.isArray()) {
                log.warn("Message mirror {} does not hold a JSON array, treating it as empty", path);
                return new ArrayList<>();
            }
            return new ArrayList<>(objectMapper.readerFor(HISTORY).<List<ChatMessage>>readValue(root));
        } catch (IOException e) {
            log.warn("Message mirror {} is unreadable, treating it as empty: {}", path, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Adds one record (without its storage id) to the end of the history.
     *
     * @return false if the artifact could not be rewritten
     */
    public boolean append(ChatMessage message) {
        writeLock.lock();
        try {
            List<ChatMessage> history = load();
            history.add(message.detached());
            write(history);
            return true;
        } catch (IOException e) {
            log.error("Failed to append message from '{}' to mirror {}", message.getUsername(), path, e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    public Path path() {
        return path;
    }

    private void write(List<ChatMessage> history) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), history);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
