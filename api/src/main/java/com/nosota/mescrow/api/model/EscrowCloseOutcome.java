package com.nosota.mescrow.api.model;

/**
 * Requested final state when closing an escrow account.
 */
public enum EscrowCloseOutcome {
    /**
     * All held funds were released; the account must be empty.
     */
    COMPLETED,

    /**
     * Remaining held funds go back to the client before the account is closed.
     */
    CANCELED
}
