package com.flagship.general_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LedgerMetrics metrics = new LedgerMetrics(registry);

    @Test
    @DisplayName("Posting counter is tagged by sanitized voucher type and outcome")
    void postingCounter() {
        metrics.recordPosting("Sales Invoice", "posted");
        metrics.recordPosting("Sales Invoice", "posted");
        metrics.recordPosting(null, "INVALID_BATCH");

        assertEquals(2.0, registry.get("ledger.postings")
            .tag("voucher_type", "Sales_Invoice").tag("outcome", "posted").counter().count());
        assertEquals(1.0, registry.get("ledger.postings")
            .tag("voucher_type", "unknown").counter().count());
    }

    @Test
    @DisplayName("Persisted entries are counted per voucher type")
    void entriesPersisted() {
        metrics.recordEntriesPersisted("Journal Entry", 3);
        metrics.recordEntriesPersisted("Journal Entry", 2);

        assertEquals(5.0, registry.get("ledger.entries.persisted").counter().count());
    }

    @Test
    @DisplayName("Posting latency is recorded per operation")
    void latency() {
        metrics.recordPostingLatency("post", 12);
        metrics.recordPostingLatency("cancel", 3);

        assertEquals(1, registry.get("ledger.posting.duration").tag("operation", "post").timer().count());
        assertEquals(1, registry.get("ledger.posting.duration").tag("operation", "cancel").timer().count());
    }
}
