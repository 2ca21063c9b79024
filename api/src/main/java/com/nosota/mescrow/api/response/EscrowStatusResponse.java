package com.nosota.mescrow.api.response;

import java.math.BigDecimal;

/**
 * Escrow account amounts in major currency units.
 */
public record EscrowStatusResponse(
        BigDecimal heldAmount,
        BigDecimal initialAmount
) {}
