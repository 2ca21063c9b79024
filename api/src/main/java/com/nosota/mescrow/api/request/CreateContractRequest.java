package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Request for creating a contract. The caller (X-User-Id) becomes the client.
 *
 * @param freelancerId Freelancer hired for the job
 * @param jobId        Job the contract was created for
 * @param amount       Agreed contract amount in major units
 * @param currency     ISO 4217 code, defaults to the service currency
 * @param startDate    Planned start date
 * @param endDate      Optional planned end date
 */
public record CreateContractRequest(
        @NotNull(message = "Freelancer ID is required")
        UUID freelancerId,

        @NotNull(message = "Job ID is required")
        UUID jobId,

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "50", message = "Contract amount must be at least 50")
        BigDecimal amount,

        @Size(min = 3, max = 3, message = "Currency must be a 3-letter ISO code")
        String currency,

        @NotNull(message = "Start date is required")
        LocalDateTime startDate,

        LocalDateTime endDate
) {
}
