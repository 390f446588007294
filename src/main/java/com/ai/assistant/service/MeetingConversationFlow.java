package com.ai.assistant.service;

import com.ai.assistant.client.CalendarClient;
import com.ai.assistant.component.ConversationStore;
import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.ContactRef;
import com.ai.assistant.conversation.EmailValidationResult;
import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.MeetingConversation;
import com.ai.assistant.conversation.TimeSlot;
import com.ai.assistant.conversation.YesNoResult;
import com.ai.assistant.utils.DateTimeParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Slot-filling for {@code schedule_meeting}: attendee (with address correction), date,
 * time, an availability check that may offer alternative slots, then booking.
 */
@Service
public class MeetingConversationFlow {

    private static final Logger log = LoggerFactory.getLogger(MeetingConversationFlow.class);

    private final ConversationStore store;
    private final EntityExtractor entityExtractor;
    private final AvailabilityResolver availability;
    private final CalendarClient calendar;
    private final ContactDirectory contacts;
    private final EmailAddressValidator addressValidator;
    private final YesNoClassifier yesNo;
    private final ResponsePhrases phrases;
    private final DialogueProperties properties;
    private final Clock clock;

    public MeetingConversationFlow(ConversationStore store, EntityExtractor entityExtractor,
                                   AvailabilityResolver availability, CalendarClient calendar,
                                   ContactDirectory contacts, EmailAddressValidator addressValidator,
                                   YesNoClassifier yesNo, ResponsePhrases phrases,
                                   DialogueProperties properties, Clock clock) {
        this.store = store;
        this.entityExtractor = entityExtractor;
        this.availability = availability;
        this.calendar = calendar;
        this.contacts = contacts;
        this.addressValidator = addressValidator;
        this.yesNo = yesNo;
        this.phrases = phrases;
        this.properties = properties;
        this.clock = clock;
    }

    public String start(String senderId, EntityBag entities) {
        MeetingConversation state = new MeetingConversation(senderId, clock.instant());
        String person = entities.firstPerson() != null ? entities.firstPerson() : entities.firstEmail();
        state.setPerson(person);
        state.setDate(entities.getDate());
        state.setTime(entities.getTime());
        state.setDurationMinutes(entities.getDurationMinutes() != null
                ? entities.getDurationMinutes() : properties.defaultMeetingMinutes());
        state.setLocation(entities.getLocation());
        state.setDescription(entities.getSubject());
        store.put(state);

        if (state.getDate() != null && state.getDate().isBefore(today())) {
            LocalDate past = state.getDate();
            state.setDate(null);
            state.setStep(person == null ? MeetingConversation.Step.PERSON : MeetingConversation.Step.DATE);
            log.info("[{}] meeting flow opened at {} (requested date {} is past)", senderId, state.getStep(), past);
            return person == null ? phrases.askMeetingPerson() : phrases.dateInPast(past);
        }
        if (person == null) {
            state.setStep(MeetingConversation.Step.PERSON);
            log.info("[{}] meeting flow opened at PERSON", senderId);
            return phrases.askMeetingPerson();
        }
        if (state.getDate() == null) {
            state.setStep(MeetingConversation.Step.DATE);
            log.info("[{}] meeting flow opened at DATE", senderId);
            return phrases.askMeetingDate(person);
        }
        state.setStep(MeetingConversation.Step.TIME);
        if (state.getTime() == null) {
            log.info("[{}] meeting flow opened at TIME", senderId);
            return phrases.askTime(state.getDate());
        }
        return checkAvailability(state);
    }

    public Optional<String> proceed(MeetingConversation state, String text) {
        switch (state.getStep()) {
            case PERSON:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                return Optional.of(onPerson(state, text));
            case CONFIRM_EMAIL:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                return Optional.of(onConfirmEmail(state, text));
            case DATE:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                return Optional.of(onDate(state, text));
            case TIME:
                if (yesNo.isCancel(text)) return Optional.of(cancel(state));
                return Optional.of(onTime(state, text));
            case CONFIRM:
                return Optional.of(onConfirm(state, text));
            default:
                return Optional.empty();
        }
    }

    private String onPerson(MeetingConversation state, String text) {
        if (text.contains("@") || text.contains(".")) {
            EmailValidationResult validation = addressValidator.validate(text);
            if (!validation.valid()) {
                if (validation.hasSuggestion()) {
                    state.setSuggestedEmail(validation.suggestedCorrection());
                    moveTo(state, MeetingConversation.Step.CONFIRM_EMAIL);
                }
                return phrases.invalidAddress(text, validation.errorMessage(), validation.suggestedCorrection());
            }
        }
        state.setPerson(text);
        return afterPerson(state);
    }

    private String onConfirmEmail(MeetingConversation state, String text) {
        if (yesNo.isAffirmative(text, YesNoClassifier.ADDRESS_CONFIRM)) {
            state.setPerson(state.getSuggestedEmail());
            state.setSuggestedEmail(null);
            return afterPerson(state);
        }
        if (text.contains("@")) {
            EmailValidationResult validation = addressValidator.validate(text);
            if (!validation.valid()) {
                if (validation.hasSuggestion()) state.setSuggestedEmail(validation.suggestedCorrection());
                return phrases.stillInvalidAddress(text, validation.errorMessage(), validation.suggestedCorrection());
            }
            state.setPerson(text);
            state.setSuggestedEmail(null);
            return afterPerson(state);
        }
        return phrases.askValidAddress();
    }

    private String afterPerson(MeetingConversation state) {
        if (state.getDate() == null) {
            moveTo(state, MeetingConversation.Step.DATE);
            return phrases.askDate();
        }
        if (state.getTime() == null) {
            moveTo(state, MeetingConversation.Step.TIME);
            return phrases.askTime(state.getDate());
        }
        return checkAvailability(state);
    }

    private String onDate(MeetingConversation state, String text) {
        EntityBag entities = entityExtractor.extract(text);
        LocalDate date = entities.getDate();
        if (date == null) return phrases.dateNotUnderstood();
        if (date.isBefore(today())) return phrases.dateInPast(date);

        state.setDate(date);
        // "friday at 3pm" answers the next question too
        if (entities.getTime() != null && DateTimeParser.firstExplicitTime(text).isPresent()) {
            state.setTime(entities.getTime());
        }
        if (state.getTime() != null) return checkAvailability(state);
        moveTo(state, MeetingConversation.Step.TIME);
        return phrases.askTime(date);
    }

    private String onTime(MeetingConversation state, String text) {
        EntityBag entities = entityExtractor.extract(text);
        if (entities.getTime() == null) return phrases.timeNotUnderstood();
        state.setTime(entities.getTime());
        return checkAvailability(state);
    }

    private String onConfirm(MeetingConversation state, String text) {
        String reply = text.trim();
        if (StringUtils.isNumeric(reply)) {
            int index = NumberUtils.toInt(reply, 0) - 1;
            List<TimeSlot> alternatives = state.getAlternativeSlots();
            if (!state.hasAlternatives() || index < 0 || index >= alternatives.size()) {
                return phrases.invalidSelection();
            }
            TimeSlot slot = alternatives.get(index);
            state.setDate(slot.start().toLocalDate());
            state.setTime(slot.start().toLocalTime());
            state.setEndTime(slot.end().toLocalTime());
            state.setDurationMinutes((int) slot.minutes());
            log.info("[{}] alternative {} chosen: {}", state.getSenderId(), index + 1, slot.start());
            return book(state);
        }
        YesNoResult answer = yesNo.classify(reply, YesNoClassifier.MEETING_CONFIRM, YesNoClassifier.MEETING_DECLINE);
        if (answer == YesNoResult.YES) return book(state);
        if (answer == YesNoResult.NO) return cancel(state);
        return phrases.confirmationNotUnderstood();
    }

    /**
     * Validates the requested start, then either asks for a direct confirmation or lists
     * free alternatives when the slot collides with an existing event.
     */
    String checkAvailability(MeetingConversation state) {
        ZoneId zone = properties.zoneId();
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        ZonedDateTime start = state.getDate().atTime(state.getTime()).atZone(zone);
        if (start.isBefore(now)) {
            String reply = phrases.timeInPast(state.getTime(), state.getDate(), now.toLocalTime());
            state.setTime(null);
            moveTo(state, MeetingConversation.Step.TIME);
            return reply;
        }

        int minutes = durationOf(state);
        TimeSlot requested = TimeSlot.of(start, minutes);
        state.setEndTime(requested.end().toLocalTime());

        if (availability.hasConflict(requested)) {
            List<TimeSlot> alternatives = availability.findAlternatives(state.getDate(), minutes);
            if (alternatives.isEmpty()) {
                LocalDate blocked = state.getDate();
                state.setAlternativeSlots(new ArrayList<>());
                moveTo(state, MeetingConversation.Step.DATE);
                return phrases.noFreeSlotsForMeeting(minutes, blocked);
            }
            state.setAlternativeSlots(new ArrayList<>(alternatives));
            moveTo(state, MeetingConversation.Step.CONFIRM);
            return phrases.conflictAlternatives(state.getTime(), state.getDate(), minutes, alternatives);
        }

        state.setAlternativeSlots(new ArrayList<>());
        String contactEmail = null;
        if (!state.getPerson().contains("@")) {
            contactEmail = contacts.findEmail(state.getPerson()).orElse(null);
        }
        moveTo(state, MeetingConversation.Step.CONFIRM);
        return phrases.confirmMeeting(minutes, state.getPerson(), contactEmail, state.getDate(), state.getTime());
    }

    private String book(MeetingConversation state) {
        String person = state.getPerson();
        List<String> attendees = new ArrayList<>();
        if (person.contains("@")) {
            EmailValidationResult validation = addressValidator.validate(person);
            if (!validation.valid()) {
                store.remove(state.getSenderId());
                return phrases.cannotScheduleInvalidAttendee(person, validation.errorMessage(), validation.suggestedCorrection());
            }
            attendees.add(person);
        } else {
            Optional<ContactRef> contact = contacts.findWithEmail(person);
            if (contact.isPresent()) {
                person = contact.get().name();
                attendees.add(contact.get().email());
            }
        }

        ZoneId zone = properties.zoneId();
        ZonedDateTime start = state.getDate().atTime(state.getTime()).atZone(zone);
        ZonedDateTime end = start.plusMinutes(durationOf(state));
        CalendarClient.CreateResult result = calendar.createEvent(new CalendarClient.NewEvent(
                "Meeting with " + person, start, end,
                state.getDescription(), state.getLocation(), attendees, true));

        store.remove(state.getSenderId());
        if (!result.success()) {
            log.warn("[{}] meeting not booked: {}", state.getSenderId(), result.error());
            return phrases.meetingFailed();
        }
        log.info("[{}] meeting booked with {} at {}", state.getSenderId(), person, start);
        return phrases.meetingScheduled(person, state.getDate(), start.toLocalTime(), end.toLocalTime(), result.link());
    }

    private int durationOf(MeetingConversation state) {
        Integer minutes = state.getDurationMinutes();
        return minutes != null && minutes > 0 ? minutes : properties.defaultMeetingMinutes();
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(properties.zoneId()));
    }

    private void moveTo(MeetingConversation state, MeetingConversation.Step next) {
        if (state.getStep() != next) {
            log.info("[{}] meeting step={} -> {}", state.getSenderId(), state.getStep(), next);
        }
        state.setStep(next);
    }

    private String cancel(MeetingConversation state) {
        store.remove(state.getSenderId());
        log.info("[{}] meeting flow canceled at {}", state.getSenderId(), state.getStep());
        return phrases.meetingCanceled();
    }
}
