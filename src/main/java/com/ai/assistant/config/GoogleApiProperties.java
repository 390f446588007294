package com.ai.assistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials and endpoints for the Google Calendar, People and Gmail REST APIs.
 * Either a static access token or a refresh token with client credentials must be set.
 */
@ConfigurationProperties(prefix = "assistant.google")
public record GoogleApiProperties(
        String calendarId,
        String accessToken,
        String clientId,
        String clientSecret,
        String refreshToken,
        String tokenUri,
        String calendarApiBase,
        String peopleApiBase,
        String gmailApiBase
) {
    public boolean hasStaticToken() {
        return notBlank(accessToken);
    }

    public boolean canRefresh() {
        return notBlank(clientId) && notBlank(clientSecret) && notBlank(refreshToken);
    }

    public boolean isConfigured() {
        return hasStaticToken() || canRefresh();
    }

    public String safeCalendarId() {
        return notBlank(calendarId) ? calendarId : "primary";
    }

    public String safeTokenUri() {
        return notBlank(tokenUri) ? tokenUri : "https://oauth2.googleapis.com/token";
    }

    public String safeCalendarApiBase() {
        return notBlank(calendarApiBase) ? calendarApiBase : "https://www.googleapis.com/calendar/v3";
    }

    public String safePeopleApiBase() {
        return notBlank(peopleApiBase) ? peopleApiBase : "https://people.googleapis.com/v1";
    }

    public String safeGmailApiBase() {
        return notBlank(gmailApiBase) ? gmailApiBase : "https://gmail.googleapis.com/gmail/v1";
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
