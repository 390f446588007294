package com.ai.assistant.client;

import com.ai.assistant.config.GoogleApiProperties;
import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Google People API ({@code people:searchContacts}). Primary contact source.
 */
@Service
@Order(1)
public class GooglePeopleContactSource implements ContactSource {

    private static final Logger log = LoggerFactory.getLogger(GooglePeopleContactSource.class);
    private static final String READ_MASK = "names,emailAddresses,phoneNumbers,organizations,addresses";

    private final GoogleApiProperties properties;
    private final GoogleAccessTokens tokens;
    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    public GooglePeopleContactSource(GoogleApiProperties properties, GoogleAccessTokens tokens, RestTemplate restTemplate) {
        this.properties = properties;
        this.tokens = tokens;
        this.restTemplate = restTemplate;
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    public ContactLookup findByName(String name) {
        if (StringUtils.isBlank(name)) return ContactLookup.notFound();
        try {
            List<ContactRef> hits = search(name);
            for (ContactRef hit : hits) {
                if (hit.hasEmail()) return ContactLookup.found(hit);
            }
            return hits.isEmpty() ? ContactLookup.notFound() : ContactLookup.found(hits.get(0));
        } catch (CollaboratorException e) {
            return ContactLookup.error(e.getMessage());
        }
    }

    @Override
    public List<ContactRef> search(String query) {
        if (StringUtils.isBlank(query)) return List.of();
        if (!tokens.isConfigured()) {
            throw new CollaboratorException("Google contacts not configured");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.safePeopleApiBase())
                .path("/people:searchContacts")
                .queryParam("query", query.trim())
                .queryParam("readMask", READ_MASK)
                .queryParam("pageSize", 10)
                .encode()
                .build()
                .toUri();
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(tokens.get());
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            JsonNode results = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}")).path("results");
            List<ContactRef> contacts = new ArrayList<>();
            for (JsonNode result : results) {
                ContactRef ref = toRef(result.path("person"));
                if (ref != null) contacts.add(ref);
            }
            log.debug("People search '{}' -> {} hits", query, contacts.size());
            return contacts;
        } catch (RestClientException e) {
            throw new CollaboratorException("People API error: " + e.getMessage(), e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("People API answer unreadable", e);
        }
    }

    private ContactRef toRef(JsonNode person) {
        String name = first(person, "names", "displayName");
        if (name == null) return null;
        return new ContactRef(
                name,
                first(person, "emailAddresses", "value"),
                first(person, "phoneNumbers", "value"),
                first(person, "organizations", "name"),
                first(person, "addresses", "formattedValue"));
    }

    private static String first(JsonNode person, String field, String key) {
        JsonNode values = person.path(field);
        if (!values.isArray() || values.isEmpty()) return null;
        return StringUtils.trimToNull(values.get(0).path(key).asText(null));
    }
}
