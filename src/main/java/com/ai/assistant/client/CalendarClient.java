package com.ai.assistant.client;

import com.ai.assistant.conversation.CalendarEvent;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Calendar backend. Read operations throw {@link CollaboratorException} on failure so
 * each caller can choose between failing open and failing closed.
 */
public interface CalendarClient {

    CreateResult createEvent(NewEvent event);

    /** Events starting in {@code [start, end)}, ordered by start time. */
    List<CalendarEvent> listEvents(ZonedDateTime start, ZonedDateTime end, int maxResults);

    Optional<CalendarEvent> nextEvent();

    record NewEvent(String summary, ZonedDateTime start, ZonedDateTime end, String description,
                    String location, List<String> attendees, boolean notifyAttendees) {
    }

    record CreateResult(boolean success, String eventId, String link, String error) {

        public static CreateResult created(String eventId, String link) {
            return new CreateResult(true, eventId, link, null);
        }

        public static CreateResult failed(String error) {
            return new CreateResult(false, null, null, error);
        }
    }
}
