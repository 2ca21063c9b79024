package com.nosota.mescrow.error;

import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends DomainException {

    private final String fromStatus;
    private final String toStatus;

    public InvalidStateTransitionException(Enum<?> fromStatus, Enum<?> toStatus) {
        super(ErrorKind.INVALID_STATE_TRANSITION, "INVALID_STATE_TRANSITION",
                String.format("Invalid status transition: %s → %s", fromStatus, toStatus));
        this.fromStatus = String.valueOf(fromStatus);
        this.toStatus = String.valueOf(toStatus);
    }

    /**
     * For operations that are not status transitions but are only allowed in some statuses.
     */
    public InvalidStateTransitionException(String code, Enum<?> currentStatus, String message) {
        super(ErrorKind.INVALID_STATE_TRANSITION, code, message);
        this.fromStatus = String.valueOf(currentStatus);
        this.toStatus = null;
    }
}
