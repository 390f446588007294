package com.ai.assistant.conversation;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Email flow: recipient, subject, body, then confirmation.
 */
@Getter
@Setter
public class EmailConversation extends ConversationState {

    public enum Step {
        RECIPIENT,
        SUBJECT,
        BODY,
        CONFIRM
    }

    private Step step = Step.RECIPIENT;
    /** Address or contact name as typed by the user. */
    private String recipient;
    private String subject;
    private String body;

    public EmailConversation(String senderId, Instant createdAt) {
        super(senderId, createdAt);
    }

    @Override
    public Kind getKind() {
        return Kind.EMAIL;
    }

    @Override
    public String stepName() {
        return step.name();
    }

    /** First slot still empty, or CONFIRM when all three are filled. */
    public Step nextMissingStep() {
        if (recipient == null) return Step.RECIPIENT;
        if (subject == null) return Step.SUBJECT;
        if (body == null) return Step.BODY;
        return Step.CONFIRM;
    }
}
