package com.llmrouter.exception;

/**
 * Requested model cannot be routed to a provider.
 */
public abstract class ModelResolutionException extends RuntimeException {

    protected ModelResolutionException(String message) {
        super(message);
    }
}
