package com.llmrouter.exception;

import lombok.Getter;

/**
 * Bearer token rejected. Callers always see the same message; the reason is
 * kept for logging and tests.
 */
@Getter
public class InvalidTokenException extends InvalidCredentialsException {

    public enum Reason {
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, Throwable cause) {
        super("Invalid or expired token", cause);
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason) {
        this(reason, null);
    }
}
