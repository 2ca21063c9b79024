package com.nosota.mescrow.api.model;

/**
 * Type of an escrow account movement.
 */
public enum EscrowTransactionType {
    /**
     * DEPOSIT: client wallet → escrow.
     */
    DEPOSIT,

    /**
     * RELEASE: escrow → freelancer pending balance.
     */
    RELEASE,

    /**
     * REFUND: escrow → client available balance.
     */
    REFUND
}
