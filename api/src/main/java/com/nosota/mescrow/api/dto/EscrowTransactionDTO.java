package com.nosota.mescrow.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Escrow account movement. Amount in major units.
 */
public record EscrowTransactionDTO(
        UUID id,
        UUID escrowAccountId,
        BigDecimal amount,
        String type,
        UUID sourceWalletId,
        UUID destinationWalletId,
        String description,
        LocalDateTime createdAt
) {}
