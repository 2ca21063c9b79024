package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Request for opening the escrow account of a contract.
 *
 * @param initialAmount Optional initial funding in major units, taken from the client's available balance
 */
public record OpenEscrowRequest(
        @PositiveOrZero(message = "Initial amount must not be negative")
        BigDecimal initialAmount
) {
}
