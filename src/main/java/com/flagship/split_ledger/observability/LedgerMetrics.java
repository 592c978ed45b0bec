package com.flagship.split_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.expenses.added: Counter of recorded expenses
 * - ledger.rounding.remainders: Counter of expenses whose split left a remainder
 * - ledger.settlements: Counter of settlement recordings, tagged by outcome
 * - ledger.reference.lookups: Counter of transfer reference lookups, tagged by result
 * - ledger.debts.simplified: Distribution of transfers produced per simplification
 * - ledger.balances.duration: Timer for balance computation
 * - ledger.latency: Timer per operation
 * - mirror.events: Counter of mirror settlement events applied, tagged by outcome
 * - ledger.discrepancies: Counter of balance mismatches found by cross-checks
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter expensesAdded;
    private final Counter roundingRemainders;
    private final DistributionSummary simplifiedDebts;
    private final Timer balancesTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.expensesAdded = Counter.builder("ledger.expenses.added")
                .description("Number of expenses recorded")
                .register(registry);

        this.roundingRemainders = Counter.builder("ledger.rounding.remainders")
                .description("Number of expenses whose equal split left an undistributed remainder")
                .register(registry);

        this.simplifiedDebts = DistributionSummary.builder("ledger.debts.simplified")
                .description("Transfers produced per debt simplification")
                .register(registry);

        this.balancesTimer = Timer.builder("ledger.balances.duration")
                .description("Time taken to compute group balances")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Counter Methods ====================

    public void incrementExpensesAdded() {
        expensesAdded.increment();
    }

    public void incrementRoundingRemainders() {
        roundingRemainders.increment();
    }

    /**
     * Records a settlement recording attempt with its outcome
     * (success, duplicate, rejected, error).
     */
    public void recordSettlement(String outcome) {
        registry.counter("ledger.settlements", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Records a transfer reference lookup (redis_hit, db_hit, miss).
     */
    public void recordReferenceLookup(String result) {
        registry.counter("ledger.reference.lookups", "result", sanitizeTag(result)).increment();
    }

    public void recordMirrorEvent(String outcome) {
        registry.counter("mirror.events", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordDiscrepancies(int count) {
        if (count > 0) {
            registry.counter("ledger.discrepancies").increment(count);
        }
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    // ==================== Timer Methods ====================

    public void recordSimplification(int transferCount) {
        simplifiedDebts.record(transferCount);
    }

    public <T> T timeBalances(Supplier<T> operation) {
        return balancesTimer.record(operation);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
