package com.llmrouter.exception;

/**
 * No active API key matches the presented secret.
 */
public class InvalidApiKeyException extends InvalidCredentialsException {

    public InvalidApiKeyException() {
        super("Invalid or expired API key");
    }
}
