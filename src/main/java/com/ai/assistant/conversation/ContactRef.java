package com.ai.assistant.conversation;

/**
 * Contact as returned by a contact source. Only name is guaranteed.
 */
public record ContactRef(String name, String email, String phone, String organization, String address) {

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
