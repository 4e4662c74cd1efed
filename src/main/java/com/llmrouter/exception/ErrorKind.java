package com.llmrouter.exception;

/**
 * Machine-checkable error classification returned in every error body.
 */
public enum ErrorKind {
    UNAUTHORIZED,
    KEY_REVOKED,
    FORBIDDEN,
    BAD_REQUEST,
    NOT_FOUND,
    UPSTREAM_FAILURE,
    INTERNAL_ERROR
}
