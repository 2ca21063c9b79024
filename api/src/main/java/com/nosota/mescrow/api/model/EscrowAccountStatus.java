package com.nosota.mescrow.api.model;

/**
 * Status of a contract escrow account.
 * Only ACTIVE accounts accept deposits, releases and refunds.
 */
public enum EscrowAccountStatus {
    ACTIVE,
    COMPLETED,
    CANCELED
}
