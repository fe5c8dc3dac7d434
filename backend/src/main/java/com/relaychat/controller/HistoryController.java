package com.relaychat.controller;

import com.relaychat.model.ChatMessage;
import com.relaychat.store.MirrorStore;
import com.relaychat.store.PrimaryStore;
import com.relaychat.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@CrossOrigin(origins = "*")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final MirrorStore mirrorStore;
    private final PrimaryStore primaryStore;

    public HistoryController(MirrorStore mirrorStore, PrimaryStore primaryStore) {
        this.mirrorStore = mirrorStore;
        this.primaryStore = primaryStore;
    }

    // -------- MIRROR: FULL HISTORY --------
    // GET /get_messages  (path the static front end polls)
    @GetMapping("/get_messages")
    public List<ChatMessage> mirrorHistory() {
        return mirrorStore.load();
    }

    // -------- HISTORY, EITHER STORE --------
    // GET /api/messages/history
    // GET /api/messages/history?source=primary&limit=100
    @GetMapping("/api/messages/history")
    public ResponseEntity<?> history(
            @RequestParam(value = "source", defaultValue = "mirror") String source,
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_LIMIT) int limit
    ) {
        if ("mirror".equalsIgnoreCase(source)) {
            return ResponseEntity.ok(mirrorStore.load());
        }
        if (!"primary".equalsIgnoreCase(source)) {
            return ResponseEntity.badRequest().body("Unknown history source: " + source);
        }
        if (limit < 1) {
            return ResponseEntity.badRequest().body("Limit must be positive.");
        }
        try {
            return ResponseEntity.ok(primaryStore.recent(Math.min(limit, MAX_LIMIT)));
        } catch (StoreUnavailableException e) {
            log.warn("History requested from unavailable primary store: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Primary message store is unavailable.");
        }
    }
}
