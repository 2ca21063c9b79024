package com.nosota.mescrow.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record ContractResponse(
        UUID id,
        UUID clientId,
        UUID freelancerId,
        UUID jobId,
        String status,
        BigDecimal amount,
        String currency,
        BigDecimal totalPaid,
        LocalDateTime startDate,
        LocalDateTime endDate,
        LocalDateTime submittedAt
) {}
