package com.nosota.mescrow.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of a money-moving operation.
 *
 * @param operation     Operation name (e.g. ESCROW_DEPOSIT)
 * @param transactionId ID of the ledger row written by the operation
 * @param amount        Amount moved, in major units
 * @param replayed      true when the Idempotency-Key was already processed and nothing was written
 * @param message       Human readable summary
 */
public record LedgerOperationResponse(
        String operation,
        UUID transactionId,
        BigDecimal amount,
        boolean replayed,
        String message
) {}
