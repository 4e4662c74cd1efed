package com.llmrouter.exception;

import lombok.Getter;

/**
 * Provider call errored or timed out.
 */
@Getter
public class UpstreamFailureException extends RuntimeException {

    private final String provider;

    public UpstreamFailureException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }
}
