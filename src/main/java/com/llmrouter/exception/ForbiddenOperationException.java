package com.llmrouter.exception;

/**
 * Authenticated caller attempted an operation on a resource it does not own.
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
