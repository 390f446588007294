package com.ai.assistant.service;

import com.ai.assistant.client.CalendarClient;
import com.ai.assistant.client.ContactSource;
import com.ai.assistant.client.EmailSender;
import com.ai.assistant.client.MessageTransport;
import com.ai.assistant.client.NamedEntityRecognizer;
import com.ai.assistant.component.ConversationStore;
import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.CalendarEvent;
import com.ai.assistant.conversation.ContactLookup;
import com.ai.assistant.conversation.ContactRef;
import com.ai.assistant.conversation.ConversationState;
import com.ai.assistant.conversation.EmailConversation;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import com.ai.assistant.conversation.MeetingConversation;
import com.ai.assistant.service.nlp.LocalEntityStrategy;
import com.ai.assistant.service.nlp.QuickKeywordIntentStrategy;
import com.ai.assistant.service.nlp.RuleBasedIntentStrategy;
import com.ai.assistant.support.MutableClock;
import com.ai.assistant.utils.DateTimeParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DialogueEngineTest {

    private static final String SENDER = "15550001111";
    // Monday, March 10 2025, 10:00 UTC
    private static final Instant NOW = Instant.parse("2025-03-10T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);
    private static final LocalDate TOMORROW = TODAY.plusDays(1);
    private static final ContactRef JANE = new ContactRef("Jane Doe", "jane@example.com", "+1 555 0101", "Globex", null);

    @Mock
    private CalendarClient calendar;
    @Mock
    private EmailSender emailSender;
    @Mock
    private ContactSource contactSource;
    @Mock
    private MessageTransport transport;
    @Mock
    private NamedEntityRecognizer recognizer;

    private final ResponsePhrases phrases = new ResponsePhrases();
    private ConversationStore store;
    private IntentClassifier classifier;
    private DialogueEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
        DialogueProperties properties = DialogueProperties.defaults();
        store = new ConversationStore(clock, properties);

        YesNoClassifier yesNo = new YesNoClassifier();
        EmailAddressValidator validator = new DefaultEmailAddressValidator();
        EntityExtractor extractor = new EntityExtractor(List.of(
                new LocalEntityStrategy(recognizer, new DateTimeParser(clock))));
        classifier = new IntentClassifier(List.of(new QuickKeywordIntentStrategy(), new RuleBasedIntentStrategy()));
        ContactDirectory contacts = new ContactDirectory(List.of(contactSource));
        AvailabilityResolver availability = new AvailabilityResolver(calendar, properties);

        EmailConversationFlow emailFlow = new EmailConversationFlow(store, contacts, emailSender, validator, yesNo, phrases, clock);
        MeetingConversationFlow meetingFlow = new MeetingConversationFlow(store, extractor, availability, calendar,
                contacts, validator, yesNo, phrases, properties, clock);
        InformationRequestService information = new InformationRequestService(calendar, availability, contacts,
                phrases, properties, clock);
        engine = new DialogueEngine(store, new ConversationLocks(properties), classifier, extractor, emailFlow,
                meetingFlow, information, transport, phrases, clock);

        when(contactSource.name()).thenReturn("test");
        when(contactSource.findByName(anyString())).thenReturn(ContactLookup.notFound());
        when(contactSource.findByName("Jane Doe")).thenReturn(ContactLookup.found(JANE));
        when(calendar.listEvents(any(), any(), anyInt())).thenReturn(List.of());
        when(calendar.createEvent(any())).thenReturn(CalendarClient.CreateResult.created("evt-1", "https://calendar/evt-1"));
        when(emailSender.send(anyString(), anyString(), anyString())).thenReturn(EmailSender.SendResult.sent());
    }

    @Test
    void meetingWithAddressGoesStraightToConfirmation() {
        String reply = engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm");

        assertEquals("I'll schedule a 30-minute meeting with john@x.com on Tuesday, March 11, 2025 at 3:00 PM. "
                + "Is that correct? (yes/no)", reply);
        assertEquals(MeetingConversation.Step.CONFIRM, meeting().getStep());
        assertFalse(meeting().hasAlternatives());

        String booked = engine.respond(SENDER, "yes");

        ArgumentCaptor<CalendarClient.NewEvent> event = ArgumentCaptor.forClass(CalendarClient.NewEvent.class);
        verify(calendar).createEvent(event.capture());
        assertEquals("Meeting with john@x.com", event.getValue().summary());
        assertEquals(TOMORROW.atTime(15, 0).atZone(ZoneOffset.UTC).toInstant(), event.getValue().start().toInstant());
        assertEquals(TOMORROW.atTime(15, 30).atZone(ZoneOffset.UTC).toInstant(), event.getValue().end().toInstant());
        assertEquals(List.of("john@x.com"), event.getValue().attendees());
        assertTrue(event.getValue().notifyAttendees());
        assertTrue(booked.startsWith("Meeting scheduled successfully!"));
        assertTrue(booked.contains("3:00 PM - 3:30 PM"));
        assertFalse(store.has(SENDER));
    }

    @Test
    void bareEmailKeywordStartsAtRecipient() {
        IntentResult intent = classifier.classify("email");
        assertEquals(Intent.SEND_EMAIL, intent.getIntent());
        assertTrue(intent.getConfidence() >= 0.9);

        String reply = engine.respond(SENDER, "email");

        assertEquals(phrases.askEmailRecipient(), reply);
        assertEquals(EmailConversation.Step.RECIPIENT, email().getStep());
    }

    @Test
    void conflictOffersNumberedAlternativesAndBooksTheChosenOne() {
        when(calendar.listEvents(any(), any(), anyInt())).thenReturn(List.of(new CalendarEvent("busy", "Standup",
                at(TOMORROW, 14, 30), at(TOMORROW, 15, 30), null, null, null)));

        String reply = engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm");

        assertTrue(reply.contains("1. 8:00 AM - 8:30 AM"), reply);
        assertTrue(reply.contains("2. 8:30 AM - 9:00 AM"), reply);
        assertTrue(reply.contains("5. 10:00 AM - 10:30 AM"), reply);
        assertFalse(reply.contains("6. "), reply);
        assertEquals(5, meeting().getAlternativeSlots().size());

        String booked = engine.respond(SENDER, "2");

        ArgumentCaptor<CalendarClient.NewEvent> event = ArgumentCaptor.forClass(CalendarClient.NewEvent.class);
        verify(calendar).createEvent(event.capture());
        assertEquals(LocalTime.of(8, 30), event.getValue().start().toLocalTime());
        assertEquals(LocalTime.of(9, 0), event.getValue().end().toLocalTime());
        assertTrue(booked.contains("8:30 AM - 9:00 AM"), booked);
        assertFalse(store.has(SENDER));
    }

    @Test
    void outOfRangeSelectionKeepsTheList() {
        when(calendar.listEvents(any(), any(), anyInt())).thenReturn(List.of(new CalendarEvent("busy", "Standup",
                at(TOMORROW, 14, 30), at(TOMORROW, 15, 30), null, null, null)));
        engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm");

        assertEquals(phrases.invalidSelection(), engine.respond(SENDER, "9"));
        assertEquals(MeetingConversation.Step.CONFIRM, meeting().getStep());
        verify(calendar, never()).createEvent(any());
    }

    @Test
    void overflowingSelectionKeepsTheConversation() {
        engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm");

        assertEquals(phrases.invalidSelection(), engine.respond(SENDER, "99999999999"));
        assertEquals(MeetingConversation.Step.CONFIRM, meeting().getStep());
        verify(calendar, never()).createEvent(any());
    }

    @Test
    void oversizedDurationOnlyLosesTheDuration() {
        String reply = engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm for 99999999999 minutes");

        assertEquals(MeetingConversation.Step.CONFIRM, meeting().getStep());
        assertEquals("john@x.com", meeting().getPerson());
        assertEquals(30, meeting().getDurationMinutes());
        assertTrue(reply.startsWith("I'll schedule a 30-minute meeting with john@x.com"), reply);
    }

    @Test
    void invalidAttendeeWithSuggestionMovesToAddressConfirmation() {
        engine.respond(SENDER, "schedule a meeting");
        assertEquals(MeetingConversation.Step.PERSON, meeting().getStep());

        String reply = engine.respond(SENDER, "contact@invalid");

        assertTrue(reply.contains("contact@invalid.com"), reply);
        assertEquals(MeetingConversation.Step.CONFIRM_EMAIL, meeting().getStep());
        assertEquals("contact@invalid.com", meeting().getSuggestedEmail());

        assertEquals(phrases.askDate(), engine.respond(SENDER, "yes"));
        assertEquals("contact@invalid.com", meeting().getPerson());
        assertEquals(MeetingConversation.Step.DATE, meeting().getStep());
    }

    @Test
    void todaysCalendarIgnoresOtherDates() {
        engine.respond(SENDER, "what's on my calendar today, not tomorrow");

        ArgumentCaptor<ZonedDateTime> from = ArgumentCaptor.forClass(ZonedDateTime.class);
        verify(calendar).listEvents(from.capture(), any(), anyInt());
        assertEquals(TODAY, from.getValue().toLocalDate());
        assertFalse(store.has(SENDER));
    }

    @Test
    void calendarWithoutDateShowsNextEvent() {
        when(calendar.nextEvent()).thenThrow(new IllegalStateException("calendar down"));

        assertEquals(phrases.noUpcomingEvents(), engine.respond(SENDER, "check my calendar"));
    }

    @Test
    void cancelClosesEveryOpenStep() {
        List<Supplier<ConversationState>> states = List.of(
                () -> emailAt(EmailConversation.Step.RECIPIENT),
                () -> emailAt(EmailConversation.Step.SUBJECT),
                () -> emailAt(EmailConversation.Step.BODY),
                () -> emailAt(EmailConversation.Step.CONFIRM),
                () -> meetingAt(MeetingConversation.Step.PERSON),
                () -> meetingAt(MeetingConversation.Step.CONFIRM_EMAIL),
                () -> meetingAt(MeetingConversation.Step.DATE),
                () -> meetingAt(MeetingConversation.Step.TIME),
                () -> meetingAt(MeetingConversation.Step.CONFIRM));

        for (Supplier<ConversationState> state : states) {
            ConversationState open = state.get();
            store.put(open);

            engine.respond(SENDER, "Cancel");

            assertFalse(store.has(SENDER), open.getKind() + " " + open.stepName());
        }
    }

    @Test
    void unresolvedRecipientRevertsInsteadOfClosing() {
        engine.respond(SENDER, "send an email subject: Lunch body: Are you free on Friday?");
        assertEquals(EmailConversation.Step.RECIPIENT, email().getStep());

        assertTrue(engine.respond(SENDER, "Zed").startsWith("I'll send an email with:"));

        String reply = engine.respond(SENDER, "yes");

        assertEquals(phrases.recipientNotFound("Zed"), reply);
        assertEquals(EmailConversation.Step.RECIPIENT, email().getStep());

        engine.respond(SENDER, "zed@example.com");
        assertEquals(phrases.emailSent("zed@example.com"), engine.respond(SENDER, "send"));
        verify(emailSender).send("zed@example.com", "Lunch", "Are you free on Friday");
        assertFalse(store.has(SENDER));
    }

    @Test
    void completeEmailIsSentAtOnce() {
        String reply = engine.respond(SENDER, "send an email to bob@example.com subject: Hi body: See you soon");

        assertEquals(phrases.emailSent("bob@example.com"), reply);
        verify(emailSender).send("bob@example.com", "Hi", "See you soon");
        assertFalse(store.has(SENDER));
    }

    @Test
    void contactNameIsResolvedForConfirmationAndBooking() {
        String reply = engine.respond(SENDER, "schedule a meeting with Jane Doe tomorrow at 10am");

        assertTrue(reply.contains("Jane Doe (jane@example.com)"), reply);

        engine.respond(SENDER, "ok");

        ArgumentCaptor<CalendarClient.NewEvent> event = ArgumentCaptor.forClass(CalendarClient.NewEvent.class);
        verify(calendar).createEvent(event.capture());
        assertEquals("Meeting with Jane Doe", event.getValue().summary());
        assertEquals(List.of("jane@example.com"), event.getValue().attendees());
    }

    @Test
    void startInThePastAsksForAnotherTime() {
        String reply = engine.respond(SENDER, "schedule a meeting with john@x.com today at 9am");

        assertTrue(reply.startsWith("The time 9:00 AM on Monday, March 10, 2025 has already passed."), reply);
        assertEquals(MeetingConversation.Step.TIME, meeting().getStep());
    }

    @Test
    void repeatedSlotValueAdvancesOnlyOnce() {
        engine.respond(SENDER, "schedule a meeting with john@x.com");
        assertEquals(MeetingConversation.Step.DATE, meeting().getStep());

        engine.respond(SENDER, "tomorrow");
        assertEquals(MeetingConversation.Step.TIME, meeting().getStep());

        assertEquals(phrases.timeNotUnderstood(), engine.respond(SENDER, "tomorrow"));
        assertEquals(MeetingConversation.Step.TIME, meeting().getStep());
        assertEquals(TOMORROW, meeting().getDate());
    }

    @Test
    void pastDateIsRejectedAtTheSameStep() {
        engine.respond(SENDER, "schedule a meeting with john@x.com");

        assertEquals(phrases.dateInPast(TODAY.minusDays(1)), engine.respond(SENDER, "yesterday"));
        assertEquals(MeetingConversation.Step.DATE, meeting().getStep());
    }

    @Test
    void unknownIntentGetsCapabilities() {
        assertEquals(phrases.capabilities(), engine.respond(SENDER, "good morning"));
        assertFalse(store.has(SENDER));
    }

    @Test
    void unexpectedFailureApologizesAndDropsState() {
        when(calendar.createEvent(any())).thenThrow(new IllegalStateException("socket closed"));
        engine.respond(SENDER, "schedule a meeting with john@x.com tomorrow at 3pm");

        String reply = engine.respond(SENDER, "yes");

        assertEquals(phrases.genericError(), reply);
        assertFalse(reply.contains("socket"));
        assertFalse(store.has(SENDER));
    }

    @Test
    void handleDeliversTheReply() {
        engine.handle(SENDER, "email", NOW);

        verify(transport).deliver(eq(SENDER), eq(phrases.askEmailRecipient()));
    }

    @Test
    void blankMessagesAreIgnored() {
        engine.handle(SENDER, "   ", NOW);

        verifyNoInteractions(transport);
    }

    private MeetingConversation meeting() {
        return assertInstanceOf(MeetingConversation.class, store.get(SENDER).orElseThrow());
    }

    private EmailConversation email() {
        return assertInstanceOf(EmailConversation.class, store.get(SENDER).orElseThrow());
    }

    private EmailConversation emailAt(EmailConversation.Step step) {
        EmailConversation state = new EmailConversation(SENDER, NOW);
        state.setStep(step);
        return state;
    }

    private MeetingConversation meetingAt(MeetingConversation.Step step) {
        MeetingConversation state = new MeetingConversation(SENDER, NOW);
        state.setStep(step);
        return state;
    }

    private static ZonedDateTime at(LocalDate date, int hour, int minute) {
        return date.atTime(hour, minute).atZone(ZoneOffset.UTC);
    }
}
