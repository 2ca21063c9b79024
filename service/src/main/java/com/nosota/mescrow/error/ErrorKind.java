package com.nosota.mescrow.error;

/**
 * Category of a {@link DomainException}. Each kind maps to exactly one HTTP status.
 */
public enum ErrorKind {
    NOT_FOUND,
    UNAUTHORIZED,
    INVALID_STATE_TRANSITION,
    INSUFFICIENT_FUNDS,
    VALIDATION_ERROR,
    NO_DELETION_REQUEST,
    INACTIVE,
    CONCURRENT_REQUEST
}
