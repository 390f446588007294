package com.ai.assistant.conversation;

import java.time.Instant;

/**
 * Open multi-step flow of one sender. Exactly one concrete variant per {@link Kind};
 * each variant carries its own step enum and slot fields.
 */
public abstract class ConversationState {

    public enum Kind {
        EMAIL,
        MEETING
    }

    private final String senderId;
    private volatile Instant lastActivity;

    protected ConversationState(String senderId, Instant createdAt) {
        this.senderId = senderId;
        this.lastActivity = createdAt;
    }

    public abstract Kind getKind();

    /** Name of the current step, for logs. */
    public abstract String stepName();

    public String getSenderId() {
        return senderId;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }
}
