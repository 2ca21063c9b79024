package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Partial milestone update. Null fields are left unchanged.
 */
public record UpdateMilestoneRequest(
        @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
        String title,

        String description,

        @DecimalMin(value = "10", message = "Milestone amount must be at least 10")
        BigDecimal amount,

        LocalDateTime dueDate
) {
}
