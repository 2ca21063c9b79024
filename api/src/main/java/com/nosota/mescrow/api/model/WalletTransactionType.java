package com.nosota.mescrow.api.model;

/**
 * Type of a wallet audit entry. Amounts are always positive, the type carries the direction.
 */
public enum WalletTransactionType {
    /**
     * DEPOSIT: funds entered the available balance from outside the system (top-up).
     */
    DEPOSIT,

    /**
     * WITHDRAWAL: funds left the available balance for a payout.
     */
    WITHDRAWAL,

    /**
     * HOLD: funds moved from the available balance into a contract escrow account.
     */
    HOLD,

    /**
     * RELEASE: funds released from escrow into the freelancer pending balance.
     */
    RELEASE,

    /**
     * ADJUSTMENT: pending → available move, or escrow refund back to the client.
     */
    ADJUSTMENT
}
