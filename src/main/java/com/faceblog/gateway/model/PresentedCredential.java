package com.faceblog.gateway.model;

/**
 * Raw credential as found on the request, before any validation.
 */
public record PresentedCredential(CredentialType type, String value) {

    public static PresentedCredential apiKey(String value) {
        return new PresentedCredential(CredentialType.API_KEY, value);
    }

    public static PresentedCredential session(String token) {
        return new PresentedCredential(CredentialType.SESSION, token);
    }

    @Override
    public String toString() {
        return "PresentedCredential{type=" + type + "}";
    }
}
