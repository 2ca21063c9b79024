package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Request for deducting a payout from the caller's available balance.
 *
 * @param amount   Amount in major currency units
 * @param payoutId Identifier of the payout (withdrawal) record owned by the payout workflow
 */
public record PayoutRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotBlank(message = "Payout ID is required")
        String payoutId
) {
}
