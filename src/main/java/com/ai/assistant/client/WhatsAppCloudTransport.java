package com.ai.assistant.client;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Text replies through the WhatsApp Cloud API (Graph API {@code /messages}).
 */
@Service
public class WhatsAppCloudTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppCloudTransport.class);
    private static final int MAX_TEXT_LENGTH = 4096;

    private final RestTemplate restTemplate;
    private final String accessToken;
    private final String phoneNumberId;
    private final String apiBase;

    public WhatsAppCloudTransport(
            RestTemplate restTemplate,
            @Value("${whatsapp.access-token:}") String accessToken,
            @Value("${whatsapp.phone-number-id:}") String phoneNumberId,
            @Value("${whatsapp.api-base:https://graph.facebook.com/v19.0}") String apiBase) {
        this.restTemplate = restTemplate;
        this.accessToken = accessToken;
        this.phoneNumberId = phoneNumberId;
        this.apiBase = StringUtils.removeEnd(apiBase, "/");
    }

    @Override
    public void deliver(String recipientId, String text) {
        if (StringUtils.isAnyBlank(recipientId, text)) {
            return;
        }
        if (StringUtils.isAnyBlank(accessToken, phoneNumberId)) {
            log.warn("WhatsApp credentials not set; skipping reply to {}", recipientId);
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("messaging_product", "whatsapp");
        body.put("recipient_type", "individual");
        body.put("to", recipientId);
        body.put("type", "text");
        body.put("text", Map.of("preview_url", false, "body", StringUtils.abbreviate(text, MAX_TEXT_LENGTH)));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    apiBase + "/" + phoneNumberId + "/messages", new HttpEntity<>(body, headers), String.class);
            if (response.getStatusCode() != HttpStatus.OK) {
                log.warn("WhatsApp send returned {} for {}", response.getStatusCode(), recipientId);
            }
        } catch (RestClientException e) {
            log.error("Failed to deliver reply to {}: {}", recipientId, e.getMessage());
        }
    }
}
