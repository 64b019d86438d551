package com.flagship.general_ledger.observability;

import com.flagship.general_ledger.ledger.PostingPolicy;
import com.flagship.general_ledger.ledger.jdbc.JdbcGlEntryStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Ledger integrity check.
 * Down if any voucher's active entries are out of balance beyond the default allowance.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final JdbcGlEntryStore glEntryStore;
    private final PostingPolicy policy;

    public LedgerHealthIndicator(JdbcGlEntryStore glEntryStore, PostingPolicy policy) {
        this.glEntryStore = glEntryStore;
        this.policy = policy;
    }

    @Override
    public Health health() {
        try {
            long unbalanced = glEntryStore.countUnbalancedVouchers(policy.getDefaultAllowance());

            Health.Builder builder = unbalanced == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("unbalancedVouchers", unbalanced)
                    .withDetail("tolerance", policy.getDefaultAllowance())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
