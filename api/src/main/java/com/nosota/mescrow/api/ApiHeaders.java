package com.nosota.mescrow.api;

/**
 * HTTP headers exchanged with the gateway.
 *
 * <p>Authentication happens in front of this service. The gateway forwards the authenticated user
 * identity and role in {@link #USER_ID} and {@link #USER_ROLE}.
 */
public final class ApiHeaders {

    public static final String USER_ID = "X-User-Id";

    public static final String USER_ROLE = "X-User-Role";

    /**
     * Optional client-generated key making a money-moving request safe to retry.
     */
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    public static final String CORRELATION_ID = "X-Correlation-ID";

    private ApiHeaders() {
    }
}
