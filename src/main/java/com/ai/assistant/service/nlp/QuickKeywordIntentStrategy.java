package com.ai.assistant.service.nlp;

import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Short, unambiguous messages ("email", "check my calendar") resolved before any
 * model is consulted.
 */
@Component
@Order(2)
public class QuickKeywordIntentStrategy implements IntentStrategy {

    static final double CALENDAR_PATTERN_CONFIDENCE = 0.95;
    static final double KEYWORD_CONFIDENCE = 0.9;

    private static final List<Pattern> CALENDAR_PATTERNS = List.of(
            Pattern.compile("what'?s\\s+on\\s+(?:my\\s+)?calendar"),
            Pattern.compile("what\\s+is\\s+on\\s+(?:my\\s+)?calendar"),
            Pattern.compile("show\\s+(?:my\\s+)?calendar"),
            Pattern.compile("check\\s+(?:my\\s+)?calendar")
    );

    private static final Map<String, Intent> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("email", Intent.SEND_EMAIL);
        KEYWORDS.put("meeting", Intent.SCHEDULE_MEETING);
        KEYWORDS.put("calendar", Intent.CHECK_CALENDAR);
        KEYWORDS.put("contact", Intent.FIND_CONTACT);
        KEYWORDS.put("free time", Intent.CHECK_FREE_SLOTS);
        KEYWORDS.put("availability", Intent.CHECK_FREE_SLOTS);
    }

    @Override
    public String name() {
        return "quick-keyword";
    }

    @Override
    public Optional<IntentResult> tryClassify(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        for (Pattern pattern : CALENDAR_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return Optional.of(IntentResult.of(Intent.CHECK_CALENDAR, CALENDAR_PATTERN_CONFIDENCE));
            }
        }
        for (Map.Entry<String, Intent> entry : KEYWORDS.entrySet()) {
            if (text.contains(entry.getKey())) {
                return Optional.of(IntentResult.of(entry.getValue(), KEYWORD_CONFIDENCE));
            }
        }
        return Optional.empty();
    }
}
