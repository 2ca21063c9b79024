package com.nosota.mescrow.api.response;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Escrow reconciliation report: {@code initialAmount + deposits - releases - refunds} compared with
 * the held amount stored on the account. All amounts are in major units.
 */
public record ReconciliationResponse(
        UUID contractId,
        BigDecimal initialAmount,
        BigDecimal totalDeposits,
        BigDecimal totalReleases,
        BigDecimal totalRefunds,
        BigDecimal heldAmount,
        boolean balanced
) {}
