package com.ai.assistant.conversation;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Half-open interval [start, end) of zone-aware instants. End is always after start.
 */
public record TimeSlot(ZonedDateTime start, ZonedDateTime end) {

    public TimeSlot {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Slot end " + end + " must be after start " + start);
        }
    }

    public static TimeSlot of(ZonedDateTime start, int minutes) {
        return new TimeSlot(start, start.plusMinutes(minutes));
    }

    /** s < be and e > bs, compared as instants. */
    public boolean overlaps(TimeSlot other) {
        return start.toInstant().isBefore(other.end.toInstant())
                && end.toInstant().isAfter(other.start.toInstant());
    }

    public long minutes() {
        return Duration.between(start, end).toMinutes();
    }
}
