package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

/**
 * Metrics for wallet and transaction operations.
 *
 * Metrics exposed:
 * - ledger.wallets.created: Counter of created wallets
 * - ledger.wallets.deactivated: Counter of deactivated wallets
 * - ledger.transactions.created: Counter of posted transactions, tagged by type (credit/debit)
 * - ledger.transactions.rejected: Counter of rejected postings, tagged by reason
 * - ledger.operation.latency: Timer per orchestration operation
 */
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter walletsCreated;
    private final Counter walletsDeactivated;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.walletsCreated = Counter.builder("ledger.wallets.created")
                .description("Number of wallets created")
                .register(registry);

        this.walletsDeactivated = Counter.builder("ledger.wallets.deactivated")
                .description("Number of wallets deactivated together with their transactions")
                .register(registry);
    }

    public void incrementWalletsCreated() {
        walletsCreated.increment();
    }

    public void incrementWalletsDeactivated() {
        walletsDeactivated.increment();
    }

    /**
     * Records a posted transaction.
     *
     * @param credit true for a positive amount, false for a debit
     */
    public void recordTransactionCreated(boolean credit) {
        registry.counter("ledger.transactions.created",
                "type", credit ? "credit" : "debit"
        ).increment();
    }

    /**
     * Records a rejected posting, e.g. reason "insufficient_balance" or "busy".
     */
    public void recordTransactionRejected(String reason) {
        registry.counter("ledger.transactions.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
