package com.ai.assistant.client;

import com.ai.assistant.config.GoogleApiProperties;
import com.ai.assistant.conversation.CalendarEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Google Calendar v3 over REST.
 */
@Service
public class GoogleCalendarClient implements CalendarClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarClient.class);

    private final GoogleApiProperties properties;
    private final GoogleAccessTokens tokens;
    private final RestTemplate restTemplate;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public GoogleCalendarClient(GoogleApiProperties properties, GoogleAccessTokens tokens,
                                RestTemplate restTemplate, Clock clock) {
        this.properties = properties;
        this.tokens = tokens;
        this.restTemplate = restTemplate;
        this.clock = clock;
    }

    @Override
    public CreateResult createEvent(NewEvent event) {
        if (!tokens.isConfigured()) {
            return CreateResult.failed("Calendar service not configured");
        }
        ZoneId zone = clock.getZone();
        Map<String, Object> payload = new HashMap<>();
        payload.put("summary", event.summary());
        if (StringUtils.isNotBlank(event.description())) payload.put("description", event.description());
        if (StringUtils.isNotBlank(event.location())) payload.put("location", event.location());
        payload.put("start", Map.of(
                "dateTime", event.start().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", zone.getId()));
        payload.put("end", Map.of(
                "dateTime", event.end().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", zone.getId()));
        if (event.attendees() != null && !event.attendees().isEmpty()) {
            List<Map<String, String>> attendees = new ArrayList<>();
            for (String email : event.attendees()) attendees.add(Map.of("email", email));
            payload.put("attendees", attendees);
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.safeCalendarApiBase())
                .path("/calendars/{calendarId}/events")
                .queryParam("sendUpdates", event.notifyAttendees() ? "all" : "none")
                .buildAndExpand(properties.safeCalendarId())
                .toUri();
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(payload, headers()), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}"));
            log.info("Calendar event created | id={} start={}", root.path("id").asText(), event.start());
            return CreateResult.created(root.path("id").asText(null), root.path("htmlLink").asText(null));
        } catch (RestClientException | CollaboratorException e) {
            log.warn("Calendar event creation failed: {}", e.getMessage());
            return CreateResult.failed("Calendar API error: " + e.getMessage());
        } catch (Exception e) {
            log.warn("Calendar create response unreadable", e);
            return CreateResult.failed("Calendar API answer unreadable");
        }
    }

    @Override
    public List<CalendarEvent> listEvents(ZonedDateTime start, ZonedDateTime end, int maxResults) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.safeCalendarApiBase())
                .path("/calendars/{calendarId}/events")
                .queryParam("timeMin", start.toInstant().toString())
                .queryParam("timeMax", end.toInstant().toString())
                .queryParam("maxResults", maxResults)
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "startTime")
                .encode()
                .buildAndExpand(properties.safeCalendarId())
                .toUri();
        return fetchEvents(uri);
    }

    @Override
    public Optional<CalendarEvent> nextEvent() {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.safeCalendarApiBase())
                .path("/calendars/{calendarId}/events")
                .queryParam("timeMin", clock.instant().toString())
                .queryParam("maxResults", 1)
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "startTime")
                .encode()
                .buildAndExpand(properties.safeCalendarId())
                .toUri();
        return fetchEvents(uri).stream().findFirst();
    }

    private List<CalendarEvent> fetchEvents(URI uri) {
        if (!tokens.isConfigured()) {
            throw new CollaboratorException("Calendar service not configured");
        }
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers()), String.class);
            JsonNode items = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}")).path("items");
            List<CalendarEvent> events = new ArrayList<>();
            for (JsonNode item : items) {
                events.add(toEvent(item));
            }
            return events;
        } catch (RestClientException e) {
            throw new CollaboratorException("Calendar API error: " + e.getMessage(), e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("Calendar API answer unreadable", e);
        }
    }

    private CalendarEvent toEvent(JsonNode item) {
        return new CalendarEvent(
                item.path("id").asText(),
                item.path("summary").asText("No Title"),
                toDateTime(item.path("start")),
                toDateTime(item.path("end")),
                item.path("description").asText(""),
                item.path("location").asText(""),
                item.path("htmlLink").asText(""));
    }

    /** Timed events carry {@code dateTime}, all-day events only {@code date}. */
    private ZonedDateTime toDateTime(JsonNode node) {
        ZoneId zone = clock.getZone();
        String dateTime = node.path("dateTime").asText("");
        if (!dateTime.isEmpty()) {
            return OffsetDateTime.parse(dateTime).atZoneSameInstant(zone);
        }
        return LocalDate.parse(node.path("date").asText()).atStartOfDay(zone);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokens.get());
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
