package com.nosota.mescrow.tests;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Executor for {@link LedgerAsyncService}. Sized above the largest fan-out of the concurrency
 * tests, so every request of a race is in flight at once.
 */
@TestConfiguration
@EnableAsync
public class TestAsyncConfig {

    static final String LEDGER_TEST_EXECUTOR = "ledgerTestExecutor";

    @Bean(name = LEDGER_TEST_EXECUTOR)
    public Executor ledgerTestExecutor() {
        return Executors.newFixedThreadPool(8, new CustomizableThreadFactory("ledger-race-"));
    }
}
