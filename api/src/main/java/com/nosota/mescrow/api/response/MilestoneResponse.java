package com.nosota.mescrow.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record MilestoneResponse(
        UUID id,
        UUID contractId,
        Integer sequence,
        String title,
        String description,
        BigDecimal amount,
        String currency,
        String status,
        LocalDateTime dueDate,
        LocalDateTime submittedAt,
        LocalDateTime approvedAt,
        LocalDateTime disputedAt,
        LocalDateTime paidAt,
        LocalDateTime deletionRequestedAt
) {}
