package com.nosota.mescrow.service;

import com.nosota.mescrow.error.DomainException;

import java.util.UUID;

/**
 * A money-moving step guarded by {@link IdempotencyService#execute}.
 */
@FunctionalInterface
public interface LedgerWrite {

    /**
     * @return ID of the ledger row written
     */
    UUID apply() throws DomainException;
}
