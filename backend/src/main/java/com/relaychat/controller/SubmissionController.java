package com.relaychat.controller;

import com.relaychat.gateway.SubmissionGateway;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@CrossOrigin(origins = "*")
public class SubmissionController {

    private final SubmissionGateway gateway;

    public SubmissionController(SubmissionGateway gateway) {
        this.gateway = gateway;
    }

    // POST /send_message  (form: username, message)
    @PostMapping(value = "/send_message", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<String> sendMessage(
            @RequestParam(value = "username", required = false) String username,
            @RequestParam(value = "message", required = false) String message
    ) {
        if (isMissing(username) || isMissing(message)) {
            return ResponseEntity.badRequest().body("Username and message are required.");
        }
        if (!gateway.forward(username, message)) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body("Message could not be delivered to the relay.");
        }
        return ResponseEntity.ok("Message sent successfully!");
    }

    private boolean isMissing(String s) {
        return s == null || s.isEmpty();
    }
}
