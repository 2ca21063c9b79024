package com.nosota.mescrow.api.model;

/**
 * Who initiated an escrow refund.
 */
public enum RefundInitiator {
    /**
     * The contract's freelancer voluntarily returns held funds to the client.
     */
    FREELANCER,

    /**
     * Platform operator (ADMIN role) returns funds, e.g. after a cancellation or a dispute.
     */
    SYSTEM
}
