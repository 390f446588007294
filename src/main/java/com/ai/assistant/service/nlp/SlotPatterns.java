package com.ai.assistant.service.nlp;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based readers for the slots no model provides: addresses, email subject and
 * body, meeting location and title, and name heuristics.
 */
final class SlotPatterns {

    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(hour|minute|min)s?", Pattern.CASE_INSENSITIVE);

    private static final String BODY_MARKER = "\\b(?:body|content|message)\\s*(?:is|:)";
    private static final String SUBJECT_MARKER = "\\b(?:subject|title)\\s*(?:is|:)";
    private static final String OPEN_QUOTE = "\\s*[\"']?";
    private static final String UNTIL_BODY = "(.+?)[\"']?\\s*(?=[,;.]?\\s*" + BODY_MARKER + "|$)";
    private static final String UNTIL_SUBJECT = "(.+?)[\"']?\\s*(?=[,;.]?\\s*" + SUBJECT_MARKER + "|$)";
    // meeting titles stop where the date, time or attendee part of the sentence starts
    private static final String UNTIL_SCHEDULE = "(.+?)[\"']?\\s*(?=[,;.]?\\s*(?:" + BODY_MARKER + "|" + SUBJECT_MARKER
            + "|\\b(?:on|at|with|in|for|from|tomorrow|today|tonight|next|this)\\b)|$)";

    private static final List<Pattern> EMAIL_SUBJECT = List.of(
            Pattern.compile("\\bsubject\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_BODY, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\babout" + OPEN_QUOTE + UNTIL_BODY, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bregarding" + OPEN_QUOTE + UNTIL_BODY, Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> EMAIL_BODY = List.of(
            Pattern.compile("\\bbody\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_SUBJECT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcontent\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_SUBJECT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmessage\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_SUBJECT, Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> MEETING_SUBJECT = List.of(
            Pattern.compile("\\bsubject\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_SCHEDULE, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\babout" + OPEN_QUOTE + UNTIL_SCHEDULE, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bregarding" + OPEN_QUOTE + UNTIL_SCHEDULE, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\btitle\\s*(?:is|:)" + OPEN_QUOTE + UNTIL_SCHEDULE, Pattern.CASE_INSENSITIVE)
    );

    private static final String DATE_TIME_WORDS =
            "today|tonight|tomorrow|yesterday|morning|afternoon|evening|night|noon|midnight|next|this|"
                    + "monday|tuesday|wednesday|thursday|friday|saturday|sunday|"
                    + "january|february|march|april|may|june|july|august|september|october|november|december";

    private static final List<Pattern> MEETING_LOCATION = List.of(
            Pattern.compile("\\b(?:at|in)\\s+(?:the\\s+)?[\"']?([a-z][\\w ]*?)[\"']?"
                    + "(?=\\s*(?:[,.;!?]|$)|\\s+(?:on|at|in|with|for|about|from|to|by|" + DATE_TIME_WORDS + ")\\b)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\blocation\\s*(?:is|:)\\s*[\"']?([\\w ]+?)[\"']?\\s*(?=[,.;!?]|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bplace\\s*(?:is|:)\\s*[\"']?([\\w ]+?)[\"']?\\s*(?=[,.;!?]|$)", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> NOT_A_LOCATION = Set.of(DATE_TIME_WORDS.split("\\|"));

    private static final Set<String> CONTACT_TRIGGERS = Set.of("for", "about", "contact", "information");
    private static final Pattern WITH_NAME = Pattern.compile("\\bwith\\s+([A-Z][a-z'-]+(?:\\s+[A-Z][a-z'-]+)*)");

    private SlotPatterns() {
    }

    static List<String> emails(String message) {
        List<String> found = new ArrayList<>();
        Matcher m = EMAIL.matcher(message);
        while (m.find()) found.add(m.group());
        return found;
    }

    /** Minutes from the first "N hour(s)" or "N minute(s)/min(s)". */
    static Optional<Integer> durationMinutes(String message) {
        Matcher m = DURATION.matcher(message);
        if (!m.find()) return Optional.empty();
        int amount = NumberUtils.toInt(m.group(1), -1);
        if (amount <= 0) return Optional.empty();
        if (!m.group(2).toLowerCase(Locale.ROOT).startsWith("hour")) return Optional.of(amount);
        try {
            return Optional.of(Math.multiplyExact(amount, 60));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    static Optional<String> emailSubject(String message) {
        return firstCapture(EMAIL_SUBJECT, message);
    }

    static Optional<String> emailBody(String message) {
        return firstCapture(EMAIL_BODY, message);
    }

    static Optional<String> meetingSubject(String message) {
        return firstCapture(MEETING_SUBJECT, message);
    }

    /**
     * First place that is not a clock time or a date/time word. Every match of a
     * pattern is considered before moving on to the next pattern.
     */
    static Optional<String> meetingLocation(String message) {
        for (Pattern pattern : MEETING_LOCATION) {
            Matcher m = pattern.matcher(message);
            while (m.find()) {
                String place = clean(m.group(1));
                if (place != null && isPlausiblePlace(place)) return Optional.of(place);
            }
        }
        return Optional.empty();
    }

    /** Capitalized words following "for", "about", "contact" or "information". */
    static Optional<String> nameAfterContactTrigger(String message) {
        String[] words = message.trim().split("\\s+");
        for (int i = 0; i < words.length - 1; i++) {
            if (!CONTACT_TRIGGERS.contains(words[i].toLowerCase(Locale.ROOT))) continue;
            List<String> parts = new ArrayList<>();
            for (int j = i + 1; j < words.length; j++) {
                String word = StringUtils.strip(words[j], ".,;:!?\"'");
                if (word.isEmpty() || !Character.isUpperCase(word.charAt(0))) break;
                parts.add(word);
            }
            if (!parts.isEmpty()) return Optional.of(String.join(" ", parts));
        }
        return Optional.empty();
    }

    /** "with Sarah Lee" in a meeting request. */
    static Optional<String> nameAfterWith(String message) {
        Matcher m = WITH_NAME.matcher(message);
        while (m.find()) {
            String name = m.group(1);
            String firstWord = name.split("\\s+")[0].toLowerCase(Locale.ROOT);
            if (!NOT_A_LOCATION.contains(firstWord)) return Optional.of(name);
        }
        return Optional.empty();
    }

    private static boolean isPlausiblePlace(String place) {
        if (Character.isDigit(place.charAt(0))) return false;
        String firstWord = place.split("\\s+")[0].toLowerCase(Locale.ROOT);
        return !NOT_A_LOCATION.contains(firstWord) && !NOT_A_LOCATION.contains(place.toLowerCase(Locale.ROOT));
    }

    private static Optional<String> firstCapture(List<Pattern> patterns, String message) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(message);
            if (m.find()) {
                String value = clean(m.group(1));
                if (value != null) return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static String clean(String raw) {
        return StringUtils.trimToNull(StringUtils.strip(raw, " \t\"'.,;:!?"));
    }
}
