package com.flagship.general_ledger.config;

import com.flagship.general_ledger.ledger.GeneralLedgerEngine;
import com.flagship.general_ledger.ledger.PostingPolicy;
import com.flagship.general_ledger.ledger.port.AccountLookup;
import com.flagship.general_ledger.ledger.port.AccountingDimensionProvider;
import com.flagship.general_ledger.ledger.port.AccountingPeriodChecker;
import com.flagship.general_ledger.ledger.port.BudgetValidator;
import com.flagship.general_ledger.ledger.port.CompanySettings;
import com.flagship.general_ledger.ledger.port.FiscalYearLookup;
import com.flagship.general_ledger.ledger.port.GlEntryStore;
import com.flagship.general_ledger.ledger.port.PartyLedgerStore;
import com.flagship.general_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Wires the posting engine.
 *
 * Configures:
 * - PostingPolicy from ledger.posting.* properties
 * - LedgerMetrics on the application MeterRegistry
 * - GeneralLedgerEngine with whichever collaborators are enabled
 */
@Configuration
public class LedgerConfig {

    @Value("${ledger.posting.precision:2}")
    private int precision;

    @Value("${ledger.posting.default-allowance:0.5}")
    private BigDecimal defaultAllowance;

    @Value("${ledger.posting.tight-allowance:0.05}")
    private BigDecimal tightAllowance;

    @Value("${ledger.posting.tight-allowance-voucher-types:Journal Entry,Payment Entry}")
    private String tightAllowanceVoucherTypes;

    @Value("${ledger.posting.period-closing-voucher-type:Period Closing Voucher}")
    private String periodClosingVoucherType;

    @Value("${ledger.posting.round-off-remark:Round Off}")
    private String roundOffRemark;

    @Value("${ledger.posting.reversal-remark-prefix:Cancelled: }")
    private String reversalRemarkPrefix;

    @Bean
    public PostingPolicy postingPolicy() {
        PostingPolicy.PostingPolicyBuilder builder = PostingPolicy.builder()
                .precision(precision)
                .defaultAllowance(defaultAllowance)
                .tightAllowance(tightAllowance)
                .periodClosingVoucherType(periodClosingVoucherType)
                .roundOffRemark(roundOffRemark)
                .reversalRemarkPrefix(reversalRemarkPrefix);
        Arrays.stream(tightAllowanceVoucherTypes.split(","))
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .forEach(builder::tightAllowanceVoucherType);
        return builder.build();
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry meterRegistry) {
        return new LedgerMetrics(meterRegistry);
    }

    /**
     * Budget, dimension, period and party ledger collaborators are optional;
     * their beans exist only when the matching ledger.*.enabled flag is on.
     */
    @Bean
    public GeneralLedgerEngine generalLedgerEngine(GlEntryStore glEntryStore,
                                                   ObjectProvider<AccountLookup> accountLookup,
                                                   ObjectProvider<CompanySettings> companySettings,
                                                   ObjectProvider<AccountingPeriodChecker> periodChecker,
                                                   ObjectProvider<FiscalYearLookup> fiscalYearLookup,
                                                   ObjectProvider<PartyLedgerStore> partyLedgerStore,
                                                   ObjectProvider<BudgetValidator> budgetValidator,
                                                   ObjectProvider<AccountingDimensionProvider> dimensionProvider,
                                                   PostingPolicy postingPolicy,
                                                   PlatformTransactionManager transactionManager,
                                                   LedgerMetrics ledgerMetrics) {
        return GeneralLedgerEngine.builder()
                .glEntryStore(glEntryStore)
                .accountLookup(accountLookup.getIfAvailable())
                .companySettings(companySettings.getIfAvailable())
                .periodChecker(periodChecker.getIfAvailable())
                .fiscalYearLookup(fiscalYearLookup.getIfAvailable())
                .partyLedgerStore(partyLedgerStore.getIfAvailable())
                .budgetValidator(budgetValidator.getIfAvailable())
                .dimensionProvider(dimensionProvider.getIfAvailable())
                .policy(postingPolicy)
                .transactionOperations(new TransactionTemplate(transactionManager))
                .metrics(ledgerMetrics)
                .build();
    }
}
