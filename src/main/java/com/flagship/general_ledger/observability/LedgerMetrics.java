package com.flagship.general_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

/**
 * Centralized metrics for GL posting.
 *
 * Metrics exposed:
 * - ledger.postings: Counter of postings, tagged by voucher type and outcome
 *   (posted, cancelled, or the error code of a rejected posting)
 * - ledger.round_off: Counter of synthesized round-off entries
 * - ledger.entries.persisted: Counter of GL entries written
 * - ledger.posting.duration: Timer per operation (post, cancel)
 */
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter roundOffEntries;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.roundOffEntries = Counter.builder("ledger.round_off")
                .description("Number of round-off entries synthesized")
                .register(registry);
    }

    public void recordPosting(String voucherType, String outcome) {
        registry.counter("ledger.postings",
                "voucher_type", sanitizeTag(voucherType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordRoundOff(String voucherType) {
        roundOffEntries.increment();
        registry.counter("ledger.round_off.by_voucher_type",
                "voucher_type", sanitizeTag(voucherType)
        ).increment();
    }

    public void recordEntriesPersisted(String voucherType, int count) {
        registry.counter("ledger.entries.persisted",
                "voucher_type", sanitizeTag(voucherType)
        ).increment(count);
    }

    public void recordPostingLatency(String operation, long durationMs) {
        registry.timer("ledger.posting.duration",
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
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
