package com.ai.assistant.controller;

import com.ai.assistant.service.InboundMessageDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
public class WhatsAppWebhookController {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppWebhookController.class);

    private final InboundMessageDispatcher dispatcher;
    private final String verifyToken;

    public WhatsAppWebhookController(InboundMessageDispatcher dispatcher,
                                     @Value("${whatsapp.verify-token:}") String verifyToken) {
        this.dispatcher = dispatcher;
        this.verifyToken = verifyToken;
    }

    /** Subscription handshake: echo the challenge when the token matches. */
    @GetMapping("/webhook")
    public ResponseEntity<String> verify(
            @RequestParam(value = "hub.mode", required = false) String mode,
            @RequestParam(value = "hub.verify_token", required = false) String token,
            @RequestParam(value = "hub.challenge", required = false) String challenge) {
        if ("subscribe".equals(mode) && StringUtils.isNotEmpty(verifyToken) && verifyToken.equals(token)) {
            log.info("Webhook verified");
            return ResponseEntity.ok(StringUtils.defaultIfEmpty(challenge, ""));
        }
        log.warn("Webhook verification rejected (mode={})", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed");
    }

    /** Always 200, otherwise the platform keeps redelivering the notification. */
    @PostMapping("/webhook")
    public ResponseEntity<String> receive(@RequestBody(required = false) JsonNode payload) {
        if (payload == null) return ResponseEntity.ok("OK");
        int accepted = 0;
        for (JsonNode entry : payload.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                for (JsonNode message : change.path("value").path("messages")) {
                    if (!"text".equals(message.path("type").asText("text"))) continue;
                    String from = message.path("from").asText("");
                    String body = message.path("text").path("body").asText("");
                    if (from.isEmpty() || StringUtils.isBlank(body)) continue;
                    dispatcher.submit(from, body, timestampOf(message));
                    accepted++;
                }
            }
        }
        log.debug("Webhook notification carried {} text message(s)", accepted);
        return ResponseEntity.ok("OK");
    }

    private static Instant timestampOf(JsonNode message) {
        String raw = message.path("timestamp").asText("");
        if (StringUtils.isNumeric(raw)) return Instant.ofEpochSecond(Long.parseLong(raw));
        return Instant.now();
    }
}
