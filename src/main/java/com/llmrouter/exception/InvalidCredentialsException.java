package com.llmrouter.exception;

/**
 * Missing, malformed, unknown or expired credential.
 *
 * The message is safe to return to callers; it never says whether a key exists.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
