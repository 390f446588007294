package com.ai.assistant.service;

import com.ai.assistant.client.CalendarClient;
import com.ai.assistant.component.ResponsePhrases;
import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.CalendarEvent;
import com.ai.assistant.conversation.ContactRef;
import com.ai.assistant.conversation.EntityBag;
import com.ai.assistant.conversation.TimeSlot;
import com.ai.assistant.utils.DisplayFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Intents answered in a single reply: calendar lookups, contact lookups, free slots.
 */
@Service
public class InformationRequestService {

    private static final Logger log = LoggerFactory.getLogger(InformationRequestService.class);

    static final Set<String> TODAY_WORDS = Set.of("today", "today's", "todays");
    static final Set<String> CONTACT_TRIGGERS = Set.of("for", "about", "contact", "email", "address", "phone");
    private static final int MAX_DAY_EVENTS = 50;

    private final CalendarClient calendar;
    private final AvailabilityResolver availability;
    private final ContactDirectory contacts;
    private final ResponsePhrases phrases;
    private final DialogueProperties properties;
    private final Clock clock;

    public InformationRequestService(CalendarClient calendar, AvailabilityResolver availability,
                                     ContactDirectory contacts, ResponsePhrases phrases,
                                     DialogueProperties properties, Clock clock) {
        this.calendar = calendar;
        this.availability = availability;
        this.contacts = contacts;
        this.phrases = phrases;
        this.properties = properties;
        this.clock = clock;
    }

    public String checkCalendar(String message, EntityBag entities) {
        LocalDate date = mentionsToday(message) ? today() : entities.getDate();
        if (date == null) {
            Optional<CalendarEvent> next;
            try {
                next = calendar.nextEvent();
            } catch (RuntimeException e) {
                log.warn("Next event lookup failed: {}", e.getMessage());
                next = Optional.empty();
            }
            return next.map(phrases::nextEvent).orElseGet(phrases::noUpcomingEvents);
        }

        ZoneId zone = properties.zoneId();
        ZonedDateTime from = date.atStartOfDay(zone);
        List<CalendarEvent> events;
        try {
            events = calendar.listEvents(from, from.plusDays(1), MAX_DAY_EVENTS);
        } catch (RuntimeException e) {
            log.warn("Listing events for {} failed: {}", date, e.getMessage());
            events = List.of();
        }
        String day = date.equals(today()) ? "today" : DisplayFormats.date(date);
        return events.isEmpty() ? phrases.noEventsForDay(day) : phrases.eventsForDay(day, events);
    }

    public String findContact(String message, EntityBag entities) {
        String query = entities.firstPerson();
        if (query == null) query = nameAfterTrigger(message);
        if (query == null) return phrases.askContactName();

        List<ContactRef> hits = contacts.search(query);
        log.info("Contact search '{}' -> {} hit(s)", query, hits.size());
        if (hits.isEmpty()) return phrases.noContacts(query);
        if (hits.size() == 1) return phrases.contactDetails(hits.get(0));
        return phrases.contactList(query, hits);
    }

    public String checkFreeSlots(EntityBag entities) {
        LocalDate date = entities.getDate() != null ? entities.getDate() : today();
        int minutes = properties.freeSlotMinutes();
        List<TimeSlot> slots = availability.getFreeSlots(date);
        return slots.isEmpty() ? phrases.noFreeSlots(minutes, date) : phrases.freeSlots(minutes, date, slots);
    }

    /** Everything after the first trigger word, e.g. "phone for Jane Doe" gives "Jane Doe". */
    static String nameAfterTrigger(String message) {
        String[] words = StringUtils.split(Objects.toString(message, ""));
        for (int i = 0; i < words.length - 1; i++) {
            if (CONTACT_TRIGGERS.contains(words[i].toLowerCase(Locale.ROOT))) {
                String rest = String.join(" ", Arrays.copyOfRange(words, i + 1, words.length));
                return StringUtils.trimToNull(StringUtils.stripEnd(rest, "?.!"));
            }
        }
        return null;
    }

    private boolean mentionsToday(String message) {
        String lower = Objects.toString(message, "").toLowerCase(Locale.ROOT);
        for (String word : StringUtils.split(lower, " \t\n?.!,")) {
            if (TODAY_WORDS.contains(word)) return true;
        }
        return false;
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(properties.zoneId()));
    }
}
