package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.RefundInitiator;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Request for refunding held escrow funds back to the client.
 *
 * @param amount    Amount in major currency units
 * @param initiator FREELANCER (caller must be the contract freelancer) or SYSTEM (caller must be ADMIN)
 */
public record RefundEscrowRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @NotNull(message = "Refund initiator is required")
        RefundInitiator initiator
) {
}
