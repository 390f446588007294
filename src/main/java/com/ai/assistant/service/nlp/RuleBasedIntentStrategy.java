package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last stage of the cascade: regular-expression groups checked in priority order, then
 * a loose keyword table. Always answers, with {@code unknown} as the floor.
 */
@Component
@Order(4)
public class RuleBasedIntentStrategy implements IntentStrategy {

    static final double PATTERN_CONFIDENCE = 0.9;
    static final double KEYWORD_CONFIDENCE = 0.7;
    static final double UNKNOWN_CONFIDENCE = 0.3;

    private static final Pattern CHECK_CALENDAR = Pattern.compile(
            "what'?s\\s+on\\s+(?:my\\s+)?calendar"
                    + "|what\\s+is\\s+on\\s+(?:my\\s+)?calendar"
                    + "|check\\s+(?:my\\s+)?calendar"
                    + "|show\\s+(?:my\\s+)?calendar"
                    + "|what\\s+do\\s+i\\s+have\\s+(?:on|for|scheduled)"
                    + "|calendar\\s+for\\s+today"
                    + "|today'?s\\s+(?:events|calendar|schedule)"
                    + "|my\\s+events|my\\s+schedule|my\\s+agenda"
                    + "|what\\s+events|any\\s+events"
                    + "|appointments\\s+(?:today|tomorrow|this week)"
                    + "|meetings\\s+(?:today|tomorrow|this week)"
    );

    private static final Pattern SEND_EMAIL = Pattern.compile(
            "send\\s+(?:an\\s+)?email"
                    + "|write\\s+(?:an\\s+)?email"
                    + "|email\\s+to"
                    + "|compose\\s+(?:an\\s+)?email"
                    + "|send\\s+(?:a\\s+)?message\\s+to"
    );

    private static final Pattern SCHEDULE_MEETING = Pattern.compile(
            "schedule\\s+(?:a\\s+)?meeting"
                    + "|set\\s+up\\s+(?:a\\s+)?meeting"
                    + "|book\\s+(?:a\\s+)?meeting"
                    + "|arrange\\s+(?:a\\s+)?meeting"
                    + "|plan\\s+(?:a\\s+)?meeting"
                    + "|set\\s+(?:a\\s+)?appointment"
    );

    private static final Pattern FIND_CONTACT = Pattern.compile(
            "find\\s+contact"
                    + "|find\\s+(?:the\\s+)?email\\s+(?:address\\s+)?(?:for|of)"
                    + "|get\\s+contact\\s+(?:info|information)"
                    + "|look\\s+up\\s+contact"
                    + "|search\\s+(?:for\\s+)?contact"
                    + "|who\\s+is"
                    + "|contact\\s+information|contact\\s+details"
    );

    private static final Pattern CHECK_FREE_SLOTS = Pattern.compile(
            "find\\s+(?:a\\s+)?free\\s+(?:slot|time)"
                    + "|check\\s+(?:my\\s+)?availability"
                    + "|when\\s+am\\s+i\\s+free"
                    + "|available\\s+(?:slot|time)"
                    + "|open\\s+(?:slot|time)"
                    + "|free\\s+time"
    );

    private static final Map<Pattern, Intent> PATTERN_GROUPS = new LinkedHashMap<>();
    private static final Map<String, Intent> KEYWORDS = new LinkedHashMap<>();

    static {
        PATTERN_GROUPS.put(CHECK_CALENDAR, Intent.CHECK_CALENDAR);
        PATTERN_GROUPS.put(SEND_EMAIL, Intent.SEND_EMAIL);
        PATTERN_GROUPS.put(SCHEDULE_MEETING, Intent.SCHEDULE_MEETING);
        PATTERN_GROUPS.put(FIND_CONTACT, Intent.FIND_CONTACT);
        PATTERN_GROUPS.put(CHECK_FREE_SLOTS, Intent.CHECK_FREE_SLOTS);

        KEYWORDS.put("email", Intent.SEND_EMAIL);
        KEYWORDS.put("mail", Intent.SEND_EMAIL);
        KEYWORDS.put("message", Intent.SEND_EMAIL);
        KEYWORDS.put("meeting", Intent.SCHEDULE_MEETING);
        KEYWORDS.put("schedule", Intent.SCHEDULE_MEETING);
        KEYWORDS.put("appointment", Intent.SCHEDULE_MEETING);
        KEYWORDS.put("calendar", Intent.CHECK_CALENDAR);
        KEYWORDS.put("events", Intent.CHECK_CALENDAR);
        KEYWORDS.put("agenda", Intent.CHECK_CALENDAR);
        KEYWORDS.put("contact", Intent.FIND_CONTACT);
        KEYWORDS.put("find", Intent.FIND_CONTACT);
        KEYWORDS.put("who is", Intent.FIND_CONTACT);
        KEYWORDS.put("availability", Intent.CHECK_FREE_SLOTS);
        KEYWORDS.put("free time", Intent.CHECK_FREE_SLOTS);
        KEYWORDS.put("when am i free", Intent.CHECK_FREE_SLOTS);
    }

    @Override
    public String name() {
        return "rule-based";
    }

    @Override
    public Optional<IntentResult> tryClassify(String message) {
        if (message == null || message.isBlank()) {
            return Optional.of(IntentResult.unknown(0.0));
        }
        String text = message.toLowerCase(Locale.ROOT);

        for (Map.Entry<Pattern, Intent> group : PATTERN_GROUPS.entrySet()) {
            if (group.getKey().matcher(text).find()) {
                return Optional.of(IntentResult.of(group.getValue(), PATTERN_CONFIDENCE));
            }
        }
        for (Map.Entry<String, Intent> keyword : KEYWORDS.entrySet()) {
            if (text.contains(keyword.getKey())) {
                return Optional.of(IntentResult.of(keyword.getValue(), KEYWORD_CONFIDENCE));
            }
        }
        return Optional.of(IntentResult.unknown(UNKNOWN_CONFIDENCE));
    }
}
