package com.nosota.mescrow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger settings bound from {@code mescrow.ledger.*}.
 */
@ConfigurationProperties(prefix = "mescrow.ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * ISO 4217 code used for wallets, escrow accounts and contracts without an explicit currency.
     */
    private String currency = "USD";

    /**
     * Upper bound, in seconds, for one ledger transaction.
     */
    private int transactionTimeout = 15;

    /**
     * Upper bound for waiting on a row lock held by another transaction.
     */
    private long lockTimeoutMillis = 5000;

    /**
     * How long a processed Idempotency-Key is honoured.
     */
    private Duration idempotencyRetention = Duration.ofDays(7);

    /**
     * Value of the Retry-After header sent with 503 LEDGER_BUSY.
     */
    private int retryAfterSeconds = 1;
}
