package com.ai.assistant.service;

import com.ai.assistant.conversation.YesNoResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * Exact-token confirmation matching. Each dialogue step passes the token sets it
 * accepts, so "send" confirms an email but not a meeting.
 */
@Service
public class YesNoClassifier {

    public static final Set<String> EMAIL_CONFIRM = Set.of("yes", "y", "sure", "ok", "send");
    public static final Set<String> ADDRESS_CONFIRM = Set.of("yes", "y", "correct", "confirm", "right");
    public static final Set<String> MEETING_CONFIRM = Set.of("yes", "y", "sure", "ok", "book");
    public static final Set<String> MEETING_DECLINE = Set.of("no", "n", "nope", "cancel");

    public YesNoResult classify(String input, Set<String> affirmative, Set<String> negative) {
        if (StringUtils.isBlank(input)) return YesNoResult.UNKNOWN;
        String text = normalize(input);
        if (affirmative.contains(text)) return YesNoResult.YES;
        if (negative.contains(text)) return YesNoResult.NO;
        return YesNoResult.UNKNOWN;
    }

    public boolean isAffirmative(String input, Set<String> affirmative) {
        return classify(input, affirmative, Set.of()) == YesNoResult.YES;
    }

    /** The literal {@code cancel}, any case. */
    public boolean isCancel(String input) {
        return input != null && "cancel".equals(normalize(input));
    }

    private static String normalize(String input) {
        return StringUtils.stripEnd(input.trim().toLowerCase(Locale.ROOT), ".!");
    }
}
