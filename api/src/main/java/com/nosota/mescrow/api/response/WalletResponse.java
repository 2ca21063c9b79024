package com.nosota.mescrow.api.response;

import java.util.UUID;

/**
 * Response for wallet initialization.
 */
public record WalletResponse(
        UUID walletId,
        UUID userId,
        String role,
        String currency
) {}
