package com.ai.assistant.conversation;

import java.time.ZonedDateTime;

/**
 * Existing calendar entry. All-day events start and end at midnight in the calendar zone.
 */
public record CalendarEvent(String id, String summary, ZonedDateTime start, ZonedDateTime end,
                            String description, String location, String link) {
}
