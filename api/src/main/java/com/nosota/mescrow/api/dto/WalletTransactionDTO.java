package com.nosota.mescrow.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Wallet audit log entry. Amount in major units.
 */
public record WalletTransactionDTO(
        UUID id,
        UUID walletId,
        BigDecimal amount,
        String type,
        String relatedId,
        Map<String, Object> metadata,
        LocalDateTime createdAt
) {}
