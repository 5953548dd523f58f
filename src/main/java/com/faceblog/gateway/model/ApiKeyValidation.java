package com.faceblog.gateway.model;

/**
 * Result of looking up a hashed key. Only {@link Outcome#VALID} carries a record.
 */
public record ApiKeyValidation(Outcome outcome, ApiKeyRecord key) {

    public enum Outcome {
        VALID,
        NOT_FOUND,
        INACTIVE,
        EXPIRED
    }

    public static ApiKeyValidation valid(ApiKeyRecord key) {
        return new ApiKeyValidation(Outcome.VALID, key);
    }

    public static ApiKeyValidation rejected(Outcome outcome) {
        return new ApiKeyValidation(outcome, null);
    }

    public boolean isValid() {
        return outcome == Outcome.VALID;
    }
}
