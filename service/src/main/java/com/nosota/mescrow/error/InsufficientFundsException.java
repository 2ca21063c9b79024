package com.nosota.mescrow.error;

import lombok.Getter;

/**
 * A debit would take a wallet balance or an escrow held amount below zero.
 * Amounts are in minor units.
 */
@Getter
public class InsufficientFundsException extends DomainException {

    private final long available;
    private final long requested;

    public InsufficientFundsException(String message, long available, long requested) {
        super(ErrorKind.INSUFFICIENT_FUNDS, "INSUFFICIENT_FUNDS",
                String.format("%s: available=%d, requested=%d", message, available, requested));
        this.available = available;
        this.requested = requested;
    }
}
