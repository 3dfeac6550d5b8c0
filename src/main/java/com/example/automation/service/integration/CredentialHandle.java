package com.example.automation.service.integration;

/**
 * A resolved secret for calling an external service. Never logged.
 */
public final class CredentialHandle {

    private static final CredentialHandle NONE = new CredentialHandle(null);

    private final String token;

    private CredentialHandle(String token) {
        this.token = token;
    }

    public static CredentialHandle of(String token) {
        return new CredentialHandle(token);
    }

    public static CredentialHandle none() {
        return NONE;
    }

    public boolean isPresent() {
        return token != null && !token.isBlank();
    }

    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return isPresent() ? "CredentialHandle[****]" : "CredentialHandle[none]";
    }
}
