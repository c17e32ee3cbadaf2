package com.automate.FindingSync.client;

import com.automate.FindingSync.exception.SonarApiException;

/**
 * Where and how to reach one SonarQube server.
 */
public record SonarConnection(
        String baseUrl,
        String token,
        String username,
        String password,
        String organization
) {
    public SonarConnection {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw SonarApiException.validation("SonarQube URL is required");
        }
        baseUrl = baseUrl.trim().replaceAll("/+$", "");
    }

    public static SonarConnection withToken(String baseUrl, String token) {
        return new SonarConnection(baseUrl, token, null, null, null);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    public boolean hasPassword() {
        return username != null && !username.isBlank() && password != null;
    }

    public boolean hasCredentials() {
        return hasToken() || hasPassword();
    }

    @Override
    public String toString() {
        return "SonarConnection{baseUrl=" + baseUrl +
                ", token=" + (hasToken() ? "****" : "none") +
                ", username=" + username +
                ", organization=" + organization +
                '}';
    }
}
