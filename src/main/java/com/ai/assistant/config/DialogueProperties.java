package com.ai.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Tunables of the dialogue engine. Unset values fall back to the documented defaults.
 */
@ConfigurationProperties(prefix = "assistant.dialogue")
public record DialogueProperties(
        String timeZone,
        Duration idleTimeout,
        Duration lockTimeout,
        Integer defaultMeetingMinutes,
        LocalTime workdayStart,
        LocalTime workdayEnd,
        LocalTime conflictSearchStart,
        LocalTime conflictSearchEnd,
        Integer freeSlotMinutes,
        Integer maxAlternatives
) {
    public DialogueProperties {
        if (timeZone == null || timeZone.isBlank()) timeZone = "UTC";
        if (idleTimeout == null) idleTimeout = Duration.ofMinutes(30);
        if (lockTimeout == null) lockTimeout = Duration.ofSeconds(90);
        if (defaultMeetingMinutes == null || defaultMeetingMinutes <= 0) defaultMeetingMinutes = 30;
        if (workdayStart == null) workdayStart = LocalTime.of(9, 0);
        if (workdayEnd == null) workdayEnd = LocalTime.of(17, 0);
        if (conflictSearchStart == null) conflictSearchStart = LocalTime.of(8, 0);
        if (conflictSearchEnd == null) conflictSearchEnd = LocalTime.of(18, 0);
        if (freeSlotMinutes == null || freeSlotMinutes <= 0) freeSlotMinutes = 30;
        if (maxAlternatives == null || maxAlternatives <= 0) maxAlternatives = 5;
    }

    public static DialogueProperties defaults() {
        return new DialogueProperties(null, null, null, null, null, null, null, null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    /** Zero or negative disables idle expiry. */
    public boolean expiresIdleConversations() {
        return !idleTimeout.isZero() && !idleTimeout.isNegative();
    }
}
