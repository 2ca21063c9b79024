package com.nosota.mescrow.dto;

import org.slf4j.MDC;

import java.time.LocalDateTime;

/**
 * Body of every error response.
 *
 * @param code          Stable machine-readable code, e.g. INSUFFICIENT_FUNDS
 * @param correlationId Correlation ID of the request, to be quoted when contacting support
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String code,
        String message,
        String path,
        String correlationId
) {
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, code, message, path, MDC.get("correlationId"));
    }
}
