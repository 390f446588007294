package com.ai.assistant.utils;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based reader for the date and time expressions people type in chat
 * ("tomorrow at 3pm", "next friday", "May 15th 2:30 pm", "2025-03-01 15:00").
 * Everything is resolved relative to the injected clock and ambiguous dates are
 * pushed into the future.
 */
@Component
public class DateTimeParser {

    private static final String MONTHS =
            "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final String WEEKDAYS =
            "(monday|tuesday|wednesday|thursday|friday|saturday|sunday)";

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final Pattern SLASH_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2}|\\d{4}))?\\b");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTHS + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTHS + "\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern DAY_AFTER_TOMORROW = Pattern.compile("\\bday after tomorrow\\b");
    private static final Pattern TOMORROW = Pattern.compile("\\b(tomorrow|tmrw|tmr)\\b");
    private static final Pattern TODAY = Pattern.compile("\\b(today|today's|todays|tonight)\\b");
    private static final Pattern YESTERDAY = Pattern.compile("\\byesterday\\b");
    private static final Pattern IN_N_UNITS = Pattern.compile("\\bin\\s+(\\d{1,3})\\s+(day|week)s?\\b");
    private static final Pattern NEXT_WEEK = Pattern.compile("\\bnext\\s+week\\b");
    private static final Pattern WEEKDAY = Pattern.compile("\\b(?:(next|this|on)\\s+)?" + WEEKDAYS + "\\b");

    private static final Pattern AM_PM_TIME = Pattern.compile(
            "\\b(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?\\s?m\\b\\.?");
    private static final Pattern CLOCK_TIME = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");
    private static final Pattern NOON = Pattern.compile("\\bnoon\\b");
    private static final Pattern MIDNIGHT = Pattern.compile("\\bmidnight\\b");
    private static final Pattern O_CLOCK = Pattern.compile("\\b(\\d{1,2})\\s*o'?\\s?clock\\b");
    private static final Pattern AT_HOUR = Pattern.compile(
            "\\bat\\s+(\\d{1,2})\\b(?!\\s*(?::|/|-|\\d|[ap]\\.?\\s?m\\b|o'?\\s?clock|min|hour|day|week))");

    /** Substrings that pin down a clock time on their own. Bare numbers never qualify. */
    private static final Pattern EXPLICIT_TIME = Pattern.compile(
            "\\b\\d{1,2}(?::\\d{2})?\\s*[ap]\\.?\\s?m\\b\\.?"
                    + "|\\b(?:[01]?\\d|2[0-3]):[0-5]\\d\\b"
                    + "|\\bnoon\\b|\\bmidnight\\b"
                    + "|\\b\\d{1,2}\\s*o'?\\s?clock\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, DayOfWeek> DAY_NAMES = Map.of(
            "monday", DayOfWeek.MONDAY,
            "tuesday", DayOfWeek.TUESDAY,
            "wednesday", DayOfWeek.WEDNESDAY,
            "thursday", DayOfWeek.THURSDAY,
            "friday", DayOfWeek.FRIDAY,
            "saturday", DayOfWeek.SATURDAY,
            "sunday", DayOfWeek.SUNDAY
    );

    private final Clock clock;

    public DateTimeParser(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Parses a date and/or a time from free text. A time found without a date is
     * anchored on today. Empty when neither could be read.
     */
    public Optional<ParsedDateTime> parse(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        String normalized = text.toLowerCase(Locale.ROOT);
        LocalDate date = findDate(normalized);
        LocalTime time = findTime(normalized);
        if (date == null && time == null) return Optional.empty();
        return Optional.of(new ParsedDateTime(date != null ? date : today(), time));
    }

    public Optional<LocalDate> parseDate(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        return Optional.ofNullable(findDate(text.toLowerCase(Locale.ROOT)));
    }

    public Optional<LocalTime> parseTime(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        return Optional.ofNullable(findTime(text.toLowerCase(Locale.ROOT)));
    }

    /** First substring that states a clock time explicitly ("3pm", "14:30", "noon"). */
    public static Optional<String> firstExplicitTime(String text) {
        if (StringUtils.isBlank(text)) return Optional.empty();
        Matcher m = EXPLICIT_TIME.matcher(text);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    private LocalDate findDate(String text) {
        LocalDate today = today();

        Matcher m = ISO_DATE.matcher(text);
        if (m.find()) {
            LocalDate date = safeDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            if (date != null) return date;
        }

        m = SLASH_DATE.matcher(text);
        if (m.find()) {
            int month = Integer.parseInt(m.group(1));
            int day = Integer.parseInt(m.group(2));
            LocalDate date = withOptionalYear(month, day, m.group(3), today);
            if (date != null) return date;
        }

        m = MONTH_DAY.matcher(text);
        if (m.find()) {
            LocalDate date = withOptionalYear(monthOf(m.group(1)), Integer.parseInt(m.group(2)), m.group(3), today);
            if (date != null) return date;
        }

        m = DAY_MONTH.matcher(text);
        if (m.find()) {
            LocalDate date = withOptionalYear(monthOf(m.group(2)), Integer.parseInt(m.group(1)), m.group(3), today);
            if (date != null) return date;
        }

        if (DAY_AFTER_TOMORROW.matcher(text).find()) return today.plusDays(2);
        if (TOMORROW.matcher(text).find()) return today.plusDays(1);
        if (TODAY.matcher(text).find()) return today;
        if (YESTERDAY.matcher(text).find()) return today.minusDays(1);

        m = IN_N_UNITS.matcher(text);
        if (m.find()) {
            int n = Integer.parseInt(m.group(1));
            return "week".equals(m.group(2)) ? today.plusWeeks(n) : today.plusDays(n);
        }

        m = WEEKDAY.matcher(text);
        if (m.find()) {
            DayOfWeek target = DAY_NAMES.get(m.group(2));
            int ahead = (target.getValue() - today.getDayOfWeek().getValue() + 7) % 7;
            if ("next".equals(m.group(1)) && ahead == 0) ahead = 7;
            return today.plusDays(ahead);
        }

        if (NEXT_WEEK.matcher(text).find()) return today.plusWeeks(1);
        return null;
    }

    private LocalTime findTime(String text) {
        Matcher m = AM_PM_TIME.matcher(text);
        if (m.find()) {
            int hour = Integer.parseInt(m.group(1));
            int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
            if (hour >= 1 && hour <= 12 && minute < 60) {
                boolean pm = "p".equals(m.group(3));
                if (hour == 12) hour = 0;
                return LocalTime.of(pm ? hour + 12 : hour, minute);
            }
        }

        m = CLOCK_TIME.matcher(text);
        if (m.find()) {
            return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }

        if (NOON.matcher(text).find()) return LocalTime.NOON;
        if (MIDNIGHT.matcher(text).find()) return LocalTime.MIDNIGHT;

        m = O_CLOCK.matcher(text);
        if (m.find()) {
            LocalTime time = bareHour(Integer.parseInt(m.group(1)));
            if (time != null) return time;
        }

        m = AT_HOUR.matcher(text);
        if (m.find()) {
            return bareHour(Integer.parseInt(m.group(1)));
        }
        return null;
    }

    // "at 3" means the afternoon; nobody books a 3am meeting in chat.
    private static LocalTime bareHour(int hour) {
        if (hour < 0 || hour > 23) return null;
        if (hour >= 1 && hour <= 7) hour += 12;
        return LocalTime.of(hour, 0);
    }

    private static LocalDate withOptionalYear(int month, int day, String yearText, LocalDate today) {
        if (month < 1) return null;
        if (yearText != null) {
            int year = Integer.parseInt(yearText);
            if (year < 100) year += 2000;
            return safeDate(year, month, day);
        }
        LocalDate date = safeDate(today.getYear(), month, day);
        if (date != null && date.isBefore(today)) {
            date = safeDate(today.getYear() + 1, month, day);
        }
        return date;
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int monthOf(String name) {
        String prefix = name.substring(0, 3);
        for (Month month : Month.values()) {
            if (month.name().toLowerCase(Locale.ROOT).startsWith(prefix)) return month.getValue();
        }
        return -1;
    }

    public record ParsedDateTime(LocalDate date, LocalTime time) {

        public boolean hasTime() {
            return time != null;
        }
    }
}
