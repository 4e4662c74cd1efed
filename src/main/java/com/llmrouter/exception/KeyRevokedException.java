package com.llmrouter.exception;

/**
 * Credential is structurally valid but the API key behind it has been deactivated.
 */
public class KeyRevokedException extends RuntimeException {

    public KeyRevokedException(String keyId) {
        super(String.format("API key '%s' is no longer active", keyId));
    }
}
