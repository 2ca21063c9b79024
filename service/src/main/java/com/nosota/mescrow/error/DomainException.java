package com.nosota.mescrow.error;

import lombok.Getter;

/**
 * Base of all business rule violations.
 * <p>
 * Ledger and lifecycle operations declare what they can reject. Transactional methods roll
 * back on it ({@code rollbackFor = Exception.class}).
 * </p>
 * <p>
 * {@link #getCode()} is a stable machine-readable code (e.g. {@code CONTRACT_INACTIVE})
 * returned to API clients next to the message.
 * </p>
 */
@Getter
public abstract class DomainException extends Exception {

    private final ErrorKind kind;
    private final String code;

    protected DomainException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    protected DomainException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }
}
