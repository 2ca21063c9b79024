package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Request for crediting funds that arrived from an external payment provider.
 *
 * <p>The provider integration itself lives outside this service; it only reports the settled amount.
 *
 * @param amount            Amount in major currency units
 * @param externalReference Provider reference (charge id, bank transfer id)
 */
public record TopUpRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        String externalReference
) {
}
