package com.nosota.mescrow.dto;

import java.util.UUID;

/**
 * Outcome of a money-moving operation.
 *
 * @param transactionId Ledger row written by the operation (or by the original request when replayed)
 * @param replayed      true when the Idempotency-Key had already been processed and nothing was written
 */
public record LedgerReceipt(UUID transactionId, boolean replayed) {

    public static LedgerReceipt written(UUID transactionId) {
        return new LedgerReceipt(transactionId, false);
    }

    public static LedgerReceipt replayed(UUID transactionId) {
        return new LedgerReceipt(transactionId, true);
    }
}
