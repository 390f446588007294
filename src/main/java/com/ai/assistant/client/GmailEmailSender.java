package com.ai.assistant.client;

import com.ai.assistant.config.GoogleApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Sends plain-text mail through the Gmail API as the authorised user.
 */
@Service
public class GmailEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(GmailEmailSender.class);

    private final GoogleApiProperties properties;
    private final GoogleAccessTokens tokens;
    private final RestTemplate restTemplate;

    public GmailEmailSender(GoogleApiProperties properties, GoogleAccessTokens tokens, RestTemplate restTemplate) {
        this.properties = properties;
        this.tokens = tokens;
        this.restTemplate = restTemplate;
    }

    @Override
    public SendResult send(String to, String subject, String body) {
        if (!tokens.isConfigured()) {
            return SendResult.failed("Email service not configured");
        }
        String url = properties.safeGmailApiBase() + "/users/me/messages/send";
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(tokens.get());
            headers.setContentType(MediaType.APPLICATION_JSON);
            Map<String, String> payload = Map.of("raw", encode(to, subject, body));
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.info("Email sent | to={} subject={}", to, subject);
            return SendResult.sent();
        } catch (RestClientException | CollaboratorException e) {
            log.warn("Email to {} failed: {}", to, e.getMessage());
            return SendResult.failed(e.getMessage());
        }
    }

    static String encode(String to, String subject, String body) {
        String mime = "To: " + to + "\r\n"
                + "Subject: =?UTF-8?B?" + Base64.getEncoder().encodeToString(subject.getBytes(StandardCharsets.UTF_8)) + "?=\r\n"
                + "MIME-Version: 1.0\r\n"
                + "Content-Type: text/plain; charset=UTF-8\r\n"
                + "\r\n"
                + body;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(mime.getBytes(StandardCharsets.UTF_8));
    }
}
