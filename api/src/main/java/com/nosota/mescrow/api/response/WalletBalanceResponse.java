package com.nosota.mescrow.api.response;

import java.math.BigDecimal;

/**
 * Wallet balances in major currency units.
 *
 * @param availableBalance Funds the user can spend or withdraw
 * @param pendingBalance   Funds released from escrow that are not yet withdrawable
 * @param totalBalance     available + pending
 */
public record WalletBalanceResponse(
        BigDecimal availableBalance,
        BigDecimal pendingBalance,
        BigDecimal totalBalance
) {}
