package com.nosota.mescrow.error;

/**
 * Another request with the same Idempotency-Key committed first. Retrying replays its result.
 */
public class IdempotencyInFlightException extends DomainException {

    public IdempotencyInFlightException(String idempotencyKey, Throwable cause) {
        super(ErrorKind.CONCURRENT_REQUEST, "IDEMPOTENCY_IN_FLIGHT",
                "A request with Idempotency-Key " + idempotencyKey + " is already being processed", cause);
    }
}
