package com.ai.assistant.component;

import com.ai.assistant.conversation.CalendarEvent;
import com.ai.assistant.conversation.ContactRef;
import com.ai.assistant.conversation.TimeSlot;
import com.ai.assistant.utils.DisplayFormats;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

@Component
public class ResponsePhrases {

    private static final String CANCEL_HINT = " (or type 'cancel' to abort)";

    public String genericError() {
        return "I'm sorry, I encountered an error while processing your request. "
                + "Please try again or rephrase your request.";
    }

    public String capabilities() {
        return "I'm not sure what you're asking for. I can help you with:\n"
                + "- Sending emails\n"
                + "- Scheduling meetings\n"
                + "- Checking your calendar\n"
                + "- Finding contacts\n"
                + "- Checking your availability\n\n"
                + "Please try phrasing your request differently.";
    }

    // email

    public String emailCanceled() {
        return "Email canceled.";
    }

    public String askEmailRecipient() {
        return "Who would you like to send an email to? (email address)";
    }

    public String askEmailSubject(String recipient) {
        return recipient == null
                ? "What's the subject of the email?" + CANCEL_HINT
                : "What's the subject of the email to " + recipient + "?" + CANCEL_HINT;
    }

    public String askEmailBody(String recipient) {
        return recipient == null
                ? "What's the content of the email?" + CANCEL_HINT
                : "What's the content of the email to " + recipient + "?" + CANCEL_HINT;
    }

    public String confirmEmail(String recipient, String subject, String body) {
        return "I'll send an email with:\n"
                + "To: " + recipient + "\n"
                + "Subject: " + subject + "\n"
                + "Body: " + body + "\n\n"
                + "Send it? (yes/no)";
    }

    public String recipientNotFound(String recipient) {
        return "I couldn't find an email for '" + recipient + "'. "
                + "Please provide a valid email address or contact name.";
    }

    public String emailSent(String recipient) {
        return "Email sent successfully to " + recipient + "!";
    }

    public String emailFailed() {
        return "Sorry, I couldn't send the email. Please try again later.";
    }

    // addresses

    public String invalidAddress(String address, String error, String suggestion) {
        String reply = "The email '" + address + "' appears to be invalid. " + Objects.toString(error, "");
        if (suggestion != null) {
            return reply + "\n\nDid you mean '" + suggestion + "'? Please confirm or provide a correct email.";
        }
        return reply + "\n\nPlease provide a valid email address.";
    }

    public String stillInvalidAddress(String address, String error, String suggestion) {
        String reply = "The email '" + address + "' still appears to be invalid. " + Objects.toString(error, "");
        if (suggestion != null) {
            return reply + "\n\nDid you mean '" + suggestion + "'?";
        }
        return reply + "\n\nPlease provide a valid email address.";
    }

    public String askValidAddress() {
        return "Please provide a valid email address or type 'cancel' to abort.";
    }

    // meeting

    public String meetingCanceled() {
        return "Meeting scheduling canceled.";
    }

    public String askMeetingPerson() {
        return "Who would you like to schedule a meeting with? (name or email address)";
    }

    public String askMeetingDate(String person) {
        return "When would you like to schedule the meeting with " + person + "? (date)";
    }

    public String askDate() {
        return "What date?" + CANCEL_HINT;
    }

    public String askTime(LocalDate date) {
        return "What time on " + DisplayFormats.date(date) + "?" + CANCEL_HINT;
    }

    public String dateNotUnderstood() {
        return "I couldn't understand that date. Please provide a specific date "
                + "like 'tomorrow', 'next Friday', or 'May 15th'.";
    }

    public String dateInPast(LocalDate date) {
        return "The date " + DisplayFormats.date(date) + " has already passed. Please provide a future date.";
    }

    public String timeNotUnderstood() {
        return "I couldn't understand that time. Please provide a specific time "
                + "like '3pm', '15:30', or 'at 2 o'clock'.";
    }

    public String timeInPast(LocalTime time, LocalDate date, LocalTime now) {
        return "The time " + DisplayFormats.time(time) + " on " + DisplayFormats.date(date) + " has already passed. "
                + "Current time is " + DisplayFormats.time(now) + ". Please provide a future time.";
    }

    public String confirmMeeting(int minutes, String person, String contactEmail, LocalDate date, LocalTime time) {
        String who = contactEmail != null ? person + " (" + contactEmail + ")" : person;
        return "I'll schedule a " + minutes + "-minute meeting with " + who
                + " on " + DisplayFormats.date(date) + " at " + DisplayFormats.time(time) + ". "
                + "Is that correct? (yes/no)";
    }

    public String conflictAlternatives(LocalTime time, LocalDate date, int minutes, List<TimeSlot> alternatives) {
        StringBuilder sb = new StringBuilder();
        sb.append("You already have a meeting at ").append(DisplayFormats.time(time))
                .append(" on ").append(DisplayFormats.date(date)).append(". ")
                .append("Here are some free ").append(minutes).append("-minute slots:\n\n");
        for (int i = 0; i < alternatives.size(); i++) {
            TimeSlot slot = alternatives.get(i);
            sb.append(i + 1).append(". ").append(DisplayFormats.time(slot.start()))
                    .append(" - ").append(DisplayFormats.time(slot.end())).append("\n");
        }
        sb.append("\nPlease choose a slot by number, or type 'cancel' to abort.");
        return sb.toString();
    }

    public String noFreeSlotsForMeeting(int minutes, LocalDate date) {
        return "I'm sorry, you don't have any free " + minutes + "-minute slots on "
                + DisplayFormats.date(date) + ". Would you like to try another date?";
    }

    public String invalidSelection() {
        return "Invalid selection. Please choose a number from the list or type 'cancel' to abort.";
    }

    public String confirmationNotUnderstood() {
        return "I didn't understand your response. Please answer with 'yes', 'no', "
                + "or the number of an alternative slot.";
    }

    public String cannotScheduleInvalidAttendee(String address, String error, String suggestion) {
        String reply = "Cannot schedule meeting: Invalid email '" + address + "'. " + Objects.toString(error, "");
        if (suggestion != null) {
            reply += "\nDid you mean '" + suggestion + "'? Please try again with the correct email.";
        }
        return reply;
    }

    public String meetingScheduled(String person, LocalDate date, LocalTime start, LocalTime end, String link) {
        return "Meeting scheduled successfully!\n\n"
                + "Meeting with " + person + "\n"
                + "Date: " + DisplayFormats.date(date) + "\n"
                + "Time: " + DisplayFormats.time(start) + " - " + DisplayFormats.time(end) + "\n"
                + "Calendar link: " + StringUtils.defaultIfBlank(link, "Not available");
    }

    public String meetingFailed() {
        return "Sorry, I couldn't schedule the meeting. Please try again later.";
    }

    // calendar

    public String nextEvent(CalendarEvent event) {
        StringBuilder sb = new StringBuilder("Your next event is:\n\n");
        sb.append(event.summary()).append("\n");
        sb.append(DisplayFormats.date(event.start().toLocalDate())).append("\n");
        sb.append(DisplayFormats.time(event.start())).append("\n");
        if (StringUtils.isNotBlank(event.location())) sb.append("Location: ").append(event.location()).append("\n");
        if (StringUtils.isNotBlank(event.description())) sb.append(event.description());
        return sb.toString().trim();
    }

    public String noUpcomingEvents() {
        return "You don't have any upcoming events on your calendar.";
    }

    public String eventsForDay(String day, List<CalendarEvent> events) {
        StringBuilder sb = new StringBuilder("Events for ").append(day).append(":\n\n");
        for (CalendarEvent event : events) {
            sb.append(DisplayFormats.time(event.start())).append(" - ").append(event.summary()).append("\n");
        }
        return sb.toString().trim();
    }

    public String noEventsForDay(String day) {
        return "You don't have any events scheduled for " + day + ".";
    }

    public String freeSlots(int minutes, LocalDate date, List<TimeSlot> slots) {
        StringBuilder sb = new StringBuilder("Free ").append(minutes).append("-minute slots for ")
                .append(DisplayFormats.date(date)).append(":\n\n");
        for (TimeSlot slot : slots) {
            sb.append(DisplayFormats.time(slot.start())).append(" - ").append(DisplayFormats.time(slot.end())).append("\n");
        }
        return sb.toString().trim();
    }

    public String noFreeSlots(int minutes, LocalDate date) {
        return "You don't have any free " + minutes + "-minute slots on " + DisplayFormats.date(date) + ".";
    }

    // contacts

    public String askContactName() {
        return "Who would you like to find contact information for?";
    }

    public String noContacts(String query) {
        return "No contacts found for '" + query + "'.";
    }

    public String contactDetails(ContactRef contact) {
        StringBuilder sb = new StringBuilder("Contact information for ").append(contact.name()).append(":\n\n");
        if (contact.email() != null) sb.append("Email: ").append(contact.email()).append("\n");
        if (contact.phone() != null) sb.append("Phone: ").append(contact.phone()).append("\n");
        if (contact.organization() != null) sb.append("Organization: ").append(contact.organization()).append("\n");
        if (contact.address() != null) sb.append("Address: ").append(contact.address()).append("\n");
        return sb.toString().trim();
    }

    public String contactList(String query, List<ContactRef> contacts) {
        StringBuilder sb = new StringBuilder("Found ").append(contacts.size())
                .append(" contacts for '").append(query).append("':\n\n");
        for (int i = 0; i < contacts.size(); i++) {
            ContactRef contact = contacts.get(i);
            sb.append(i + 1).append(". ").append(contact.name());
            if (contact.email() != null) sb.append(" (").append(contact.email()).append(")");
            if (contact.phone() != null) sb.append(" - ").append(contact.phone());
            sb.append("\n");
        }
        return sb.toString().trim();
    }
}
