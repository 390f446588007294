package com.ai.assistant.conversation;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Meeting flow: attendee, optional address correction, date, time, then confirmation
 * (direct, or choosing among alternative slots after a conflict).
 */
@Getter
@Setter
public class MeetingConversation extends ConversationState {

    public enum Step {
        PERSON,
        CONFIRM_EMAIL,
        DATE,
        TIME,
        CONFIRM
    }

    private Step step = Step.PERSON;
    /** Attendee as a name or an address. */
    private String person;
    /** Correction offered for an invalid attendee address, pending user confirmation. */
    private String suggestedEmail;
    private LocalDate date;
    private LocalTime time;
    private LocalTime endTime;
    private Integer durationMinutes;
    private String location;
    private String description;
    private List<TimeSlot> alternativeSlots = new ArrayList<>();

    public MeetingConversation(String senderId, Instant createdAt) {
        super(senderId, createdAt);
    }

    @Override
    public Kind getKind() {
        return Kind.MEETING;
    }

    @Override
    public String stepName() {
        return step.name();
    }

    public boolean hasAlternatives() {
        return alternativeSlots != null && !alternativeSlots.isEmpty();
    }
}
