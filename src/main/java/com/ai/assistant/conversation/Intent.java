package com.ai.assistant.conversation;

import java.util.Locale;

/**
 * Actions a user message can request. The code is the wire name used by the
 * remote language provider and in logs.
 */
public enum Intent {
    SEND_EMAIL("send_email"),
    SCHEDULE_MEETING("schedule_meeting"),
    CHECK_CALENDAR("check_calendar"),
    FIND_CONTACT("find_contact"),
    CHECK_FREE_SLOTS("check_free_slots"),
    UNKNOWN("unknown");

    private final String code;

    Intent(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Maps a wire name (case-insensitive) to an intent; anything unrecognised is UNKNOWN. */
    public static Intent fromCode(String code) {
        if (code == null) return UNKNOWN;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Intent intent : values()) {
            if (intent.code.equals(normalized)) return intent;
        }
        return UNKNOWN;
    }
}
