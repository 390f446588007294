package com.ai.assistant.utils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats used in every message shown to users.
 */
public final class DisplayFormats {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private DisplayFormats() {
    }

    public static String date(LocalDate date) {
        return date == null ? "" : DATE.format(date);
    }

    public static String time(LocalTime time) {
        return time == null ? "" : TIME.format(time);
    }

    public static String time(ZonedDateTime dateTime) {
        return dateTime == null ? "" : TIME.format(dateTime);
    }

    public static String dateTime(ZonedDateTime dateTime) {
        return dateTime == null ? "" : DATE.format(dateTime) + " at " + TIME.format(dateTime);
    }
}
