package com.nosota.mescrow.api.request;

import com.nosota.mescrow.api.model.EscrowCloseOutcome;
import jakarta.validation.constraints.NotNull;

public record CloseEscrowRequest(
        @NotNull(message = "Outcome is required")
        EscrowCloseOutcome outcome
) {
}
