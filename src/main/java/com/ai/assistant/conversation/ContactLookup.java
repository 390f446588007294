package com.ai.assistant.conversation;

/**
 * Outcome of looking a name up in one contact source.
 */
public record ContactLookup(Status status, ContactRef contact, String error) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        ERROR
    }

    public static ContactLookup found(ContactRef contact) {
        return new ContactLookup(Status.FOUND, contact, null);
    }

    public static ContactLookup notFound() {
        return new ContactLookup(Status.NOT_FOUND, null, null);
    }

    public static ContactLookup error(String error) {
        return new ContactLookup(Status.ERROR, null, error);
    }

    public boolean isFoundWithEmail() {
        return status == Status.FOUND && contact != null && contact.hasEmail();
    }
}
