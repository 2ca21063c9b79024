package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Request carrying a single amount, used for escrow deposit/release and the pending → available move.
 *
 * @param amount Amount in major currency units (e.g. dollars). Converted to minor units by the service.
 */
public record AmountRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount
) {
}
