package com.ai.assistant.service;

import com.ai.assistant.client.CalendarClient;
import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.CalendarEvent;
import com.ai.assistant.conversation.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Free/busy arithmetic over a day's calendar events. Listing fails closed (a calendar
 * error yields no free slots); conflict detection fails open (an error means no conflict).
 */
@Service
public class AvailabilityResolver {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityResolver.class);
    private static final int MAX_EVENTS = 250;

    private final CalendarClient calendarClient;
    private final DialogueProperties properties;
    private final ZoneId zone;

    public AvailabilityResolver(CalendarClient calendarClient, DialogueProperties properties) {
        this.calendarClient = calendarClient;
        this.properties = properties;
        this.zone = properties.zoneId();
    }

    public List<TimeSlot> getFreeSlots(LocalDate date) {
        return getFreeSlots(date, properties.workdayStart(), properties.workdayEnd(), properties.freeSlotMinutes());
    }

    public List<TimeSlot> getFreeSlots(LocalDate date, LocalTime workdayStart, LocalTime workdayEnd, int slotMinutes) {
        ZonedDateTime start = date.atTime(workdayStart).atZone(zone);
        ZonedDateTime end = date.atTime(workdayEnd).atZone(zone);
        List<TimeSlot> grid = buildGrid(start, end, slotMinutes);
        if (grid.isEmpty()) return grid;

        List<CalendarEvent> busy;
        try {
            busy = calendarClient.listEvents(start, end, MAX_EVENTS);
        } catch (RuntimeException e) {
            log.warn("Could not read calendar for {}, reporting no free slots: {}", date, e.getMessage());
            return List.of();
        }

        List<TimeSlot> free = new ArrayList<>();
        for (TimeSlot slot : grid) {
            if (busy.stream().noneMatch(event -> overlaps(slot, event))) {
                free.add(slot);
            }
        }
        return free;
    }

    /** True when an existing event overlaps {@code proposed}. False if the calendar cannot be read. */
    public boolean hasConflict(TimeSlot proposed) {
        try {
            return calendarClient.listEvents(proposed.start(), proposed.end(), MAX_EVENTS).stream()
                    .anyMatch(event -> overlaps(proposed, event));
        } catch (RuntimeException e) {
            log.warn("Could not check conflicts for {}, assuming none: {}", proposed, e.getMessage());
            return false;
        }
    }

    /** Up to the configured number of free slots of the requested length in the wider search window. */
    public List<TimeSlot> findAlternatives(LocalDate date, int durationMinutes) {
        List<TimeSlot> free = getFreeSlots(date, properties.conflictSearchStart(), properties.conflictSearchEnd(), durationMinutes);
        return free.size() > properties.maxAlternatives() ? free.subList(0, properties.maxAlternatives()) : free;
    }

    /**
     * Contiguous slots of {@code minutes} from {@code start}; a remainder shorter than
     * one slot at the end is left out.
     */
    public static List<TimeSlot> buildGrid(ZonedDateTime start, ZonedDateTime end, int minutes) {
        List<TimeSlot> grid = new ArrayList<>();
        if (minutes <= 0) return grid;
        ZonedDateTime cursor = start;
        while (!cursor.plusMinutes(minutes).isAfter(end)) {
            grid.add(TimeSlot.of(cursor, minutes));
            cursor = cursor.plusMinutes(minutes);
        }
        return grid;
    }

    /** {@code [s,e)} conflicts with {@code [bs,be)} iff {@code s < be && e > bs}. */
    public static boolean overlaps(TimeSlot slot, CalendarEvent event) {
        if (event.start() == null || event.end() == null || !event.end().isAfter(event.start())) return false;
        return slot.overlaps(new TimeSlot(event.start(), event.end()));
    }
}
