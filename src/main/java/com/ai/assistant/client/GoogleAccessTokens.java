package com.ai.assistant.client;

import com.ai.assistant.config.GoogleApiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Access token shared by the Google adapters: the configured static token, or one
 * obtained from the refresh token and cached until shortly before it expires.
 */
@Component
public class GoogleAccessTokens {

    private static final Logger log = LoggerFactory.getLogger(GoogleAccessTokens.class);

    private final GoogleApiProperties properties;
    private final RestTemplate restTemplate;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    private String cachedToken;
    private long expiresAtEpochSec;

    public GoogleAccessTokens(GoogleApiProperties properties, RestTemplate restTemplate, Clock clock) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return properties.isConfigured();
    }

    public synchronized String get() {
        if (properties.hasStaticToken()) return properties.accessToken();
        if (!properties.canRefresh()) {
            throw new CollaboratorException("Google credentials are not configured");
        }
        long now = clock.instant().getEpochSecond();
        if (cachedToken != null && now < expiresAtEpochSec - 30) return cachedToken;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", properties.clientId());
        body.add("client_secret", properties.clientSecret());
        body.add("refresh_token", properties.refreshToken());
        body.add("grant_type", "refresh_token");

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    properties.safeTokenUri(), new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody() == null ? "{}" : response.getBody());
            String token = root.path("access_token").asText("");
            if (token.isEmpty()) {
                throw new CollaboratorException("Google token response has no access_token");
            }
            cachedToken = token;
            expiresAtEpochSec = now + root.path("expires_in").asLong(3600);
            log.debug("Refreshed Google access token, valid for {}s", expiresAtEpochSec - now);
            return cachedToken;
        } catch (RestClientException e) {
            throw new CollaboratorException("Google token refresh failed: " + e.getMessage(), e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("Google token response unreadable", e);
        }
    }
}
