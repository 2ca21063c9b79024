package com.nosota.mescrow.api.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record CreateMilestoneRequest(
        @NotNull(message = "Contract ID is required")
        UUID contractId,

        @NotBlank(message = "Title is required")
        @Size(max = 255, message = "Title must be at most 255 characters")
        String title,

        String description,

        @NotNull(message = "Amount is required")
        @DecimalMin(value = "10", message = "Milestone amount must be at least 10")
        BigDecimal amount,

        @NotNull(message = "Due date is required")
        LocalDateTime dueDate
) {
}
