package com.ai.assistant.conversation;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Slot values pulled out of one message. A key is either present with a usable value
 * or absent: blank strings, empty lists and non-positive durations are never stored.
 * <p>
 * Date and time are normally typed values. When a provider answers with free text that
 * cannot be parsed, the original text is kept in {@code dateText}/{@code timeText} and the
 * key still counts as present.
 */
public class EntityBag {

    public enum Key {
        PERSON,
        DATE,
        TIME,
        DURATION,
        EMAIL,
        SUBJECT,
        BODY,
        LOCATION
    }

    private final List<String> persons = new ArrayList<>();
    private LocalDate date;
    private String dateText;
    private LocalTime time;
    private String timeText;
    private Integer durationMinutes;
    private final List<String> emails = new ArrayList<>();
    private String subject;
    private String body;
    private String location;

    public static EntityBag empty() {
        return new EntityBag();
    }

    public List<String> getPersons() {
        return Collections.unmodifiableList(persons);
    }

    public void addPerson(String person) {
        if (StringUtils.isNotBlank(person)) persons.add(person.trim());
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
        if (date != null) this.dateText = null;
    }

    public String getDateText() {
        return dateText;
    }

    public void setDateText(String dateText) {
        this.dateText = StringUtils.trimToNull(dateText);
    }

    public LocalTime getTime() {
        return time;
    }

    public void setTime(LocalTime time) {
        this.time = time;
        if (time != null) this.timeText = null;
    }

    public String getTimeText() {
        return timeText;
    }

    public void setTimeText(String timeText) {
        this.timeText = StringUtils.trimToNull(timeText);
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(Integer durationMinutes) {
        this.durationMinutes = durationMinutes != null && durationMinutes > 0 ? durationMinutes : null;
    }

    public List<String> getEmails() {
        return Collections.unmodifiableList(emails);
    }

    public void addEmail(String email) {
        if (StringUtils.isNotBlank(email)) emails.add(email.trim());
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = StringUtils.trimToNull(subject);
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = StringUtils.trimToNull(body);
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = StringUtils.trimToNull(location);
    }

    public String firstPerson() {
        return persons.isEmpty() ? null : persons.get(0);
    }

    public String firstEmail() {
        return emails.isEmpty() ? null : emails.get(0);
    }

    public boolean has(Key key) {
        switch (key) {
            case PERSON: return !persons.isEmpty();
            case DATE: return date != null || dateText != null;
            case TIME: return time != null || timeText != null;
            case DURATION: return durationMinutes != null;
            case EMAIL: return !emails.isEmpty();
            case SUBJECT: return subject != null;
            case BODY: return body != null;
            case LOCATION: return location != null;
            default: return false;
        }
    }

    public Set<Key> presentKeys() {
        Set<Key> keys = EnumSet.noneOf(Key.class);
        for (Key key : Key.values()) {
            if (has(key)) keys.add(key);
        }
        return keys;
    }

    public boolean isEmpty() {
        return presentKeys().isEmpty();
    }

    /**
     * Copies every key present in {@code other} over this bag. Keys absent in
     * {@code other} are left untouched.
     */
    public EntityBag mergeFrom(EntityBag other) {
        if (other == null) return this;
        if (other.has(Key.PERSON)) {
            persons.clear();
            persons.addAll(other.persons);
        }
        if (other.has(Key.DATE)) {
            date = other.date;
            dateText = other.dateText;
        }
        if (other.has(Key.TIME)) {
            time = other.time;
            timeText = other.timeText;
        }
        if (other.has(Key.DURATION)) durationMinutes = other.durationMinutes;
        if (other.has(Key.EMAIL)) {
            emails.clear();
            emails.addAll(other.emails);
        }
        if (other.has(Key.SUBJECT)) subject = other.subject;
        if (other.has(Key.BODY)) body = other.body;
        if (other.has(Key.LOCATION)) location = other.location;
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EntityBag{");
        if (!persons.isEmpty()) sb.append("person=").append(persons).append(' ');
        if (date != null) sb.append("date=").append(date).append(' ');
        if (dateText != null) sb.append("dateText='").append(dateText).append("' ");
        if (time != null) sb.append("time=").append(time).append(' ');
        if (timeText != null) sb.append("timeText='").append(timeText).append("' ");
        if (durationMinutes != null) sb.append("duration=").append(durationMinutes).append(' ');
        if (!emails.isEmpty()) sb.append("email=").append(emails).append(' ');
        if (subject != null) sb.append("subject='").append(subject).append("' ");
        if (body != null) sb.append("body='").append(body).append("' ");
        if (location != null) sb.append("location='").append(location).append("' ");
        return sb.toString().trim() + "}";
    }
}
