package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.error.PostingError;
import com.flagship.general_ledger.ledger.port.Account;
import com.flagship.general_ledger.ledger.port.AccountLookup;
import com.flagship.general_ledger.ledger.port.AccountingDimension;
import com.flagship.general_ledger.ledger.port.AccountingDimensionProvider;
import com.flagship.general_ledger.ledger.port.AccountingPeriodChecker;
import com.flagship.general_ledger.ledger.port.BudgetValidator;
import com.flagship.general_ledger.ledger.port.BudgetViolation;
import com.flagship.general_ledger.ledger.port.CompanySettings;
import com.flagship.general_ledger.ledger.port.FiscalYear;
import com.flagship.general_ledger.ledger.port.FiscalYearLookup;
import com.flagship.general_ledger.ledger.port.GlEntryStore;
import com.flagship.general_ledger.ledger.port.PartyLedgerStore;
import com.flagship.general_ledger.ledger.processing.DebitCreditReconciler;
import com.flagship.general_ledger.ledger.processing.DebitCreditReconciler.RoundOffTarget;
import com.flagship.general_ledger.ledger.processing.DimensionOffsetter;
import com.flagship.general_ledger.ledger.processing.GlMapProcessor;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.observability.PostingContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Posts batches of GL entries to the ledger.
 *
 * Posting path (each step short-circuits on failure):
 * 1. Duplicate voucher guard (skipped when reposting)
 * 2. Budget validation (skipped for period closing vouchers and reposts)
 * 3. Accounting dimension offsetting entries
 * 4. Accounting period check
 * 5. Account validation: disabled (all reported at once), missing, group, frozen, currency
 * 6. Fiscal year stamping
 * 7. Merge and negative-amount normalization
 * 8. At least two entries must remain
 * 9. Party ledger projection (held until the save)
 * 10. Debit/credit reconciliation with optional round-off entry
 * 11. Accounts-frozen / books-closed dates
 * 12. Save of party ledger and GL entries
 *
 * Cancellation path: the stored entries of the voucher are reversed (debit and
 * credit swapped), the originals marked cancelled and the reversal saved as one unit.
 *
 * Every posting runs inside the configured {@link TransactionOperations}; a
 * failure result rolls the transaction back so nothing is persisted.
 *
 * Only the entry store is mandatory. Any other collaborator may be omitted,
 * which skips the checks that depend on it.
 */
@Slf4j
public class GeneralLedgerEngine {

    static final String ENTRY_NAME_PREFIX = "ACC-GLE-";
    private static final int MIN_ENTRIES = 2;

    private final GlEntryStore glEntryStore;
    private final AccountLookup accountLookup;
    private final CompanySettings companySettings;
    private final AccountingPeriodChecker periodChecker;
    private final FiscalYearLookup fiscalYearLookup;
    private final PartyLedgerStore partyLedgerStore;
    private final BudgetValidator budgetValidator;
    private final AccountingDimensionProvider dimensionProvider;
    private final PostingPolicy policy;
    private final TransactionOperations transactionOperations;
    private final LedgerMetrics metrics;

    private final GlMapProcessor processor;
    private final DimensionOffsetter dimensionOffsetter;
    private final DebitCreditReconciler reconciler;

    @Builder
    private GeneralLedgerEngine(GlEntryStore glEntryStore,
                                AccountLookup accountLookup,
                                CompanySettings companySettings,
                                AccountingPeriodChecker periodChecker,
                                FiscalYearLookup fiscalYearLookup,
                                PartyLedgerStore partyLedgerStore,
                                BudgetValidator budgetValidator,
                                AccountingDimensionProvider dimensionProvider,
                                PostingPolicy policy,
                                TransactionOperations transactionOperations,
                                LedgerMetrics metrics) {
        this.glEntryStore = Objects.requireNonNull(glEntryStore, "glEntryStore");
        this.accountLookup = accountLookup;
        this.companySettings = companySettings;
        this.periodChecker = periodChecker;
        this.fiscalYearLookup = fiscalYearLookup;
        this.partyLedgerStore = partyLedgerStore;
        this.budgetValidator = budgetValidator;
        this.dimensionProvider = dimensionProvider;
        this.policy = policy != null ? policy : PostingPolicy.defaults();
        this.transactionOperations = transactionOperations != null
            ? transactionOperations : TransactionOperations.withoutTransaction();
        this.metrics = metrics != null ? metrics : new LedgerMetrics(new SimpleMeterRegistry());

        this.processor = new GlMapProcessor(this.policy.getPrecision());
        this.dimensionOffsetter = new DimensionOffsetter(this.policy.getPrecision());
        this.reconciler = new DebitCreditReconciler(this.policy);
    }

    /**
     * Posts a batch, or reverses the voucher's stored entries when
     * {@code options.isCancel()} is set.
     *
     * @param batch Entries of one voucher
     * @param options Posting flags
     * @return the batch that was persisted (the reversal, when cancelling), or the first failure
     */
    public PostingResult<GlBatch> post(GlBatch batch, PostingOptions options) {
        PostingResult<GlBatch> input = validateInput(batch, options);
        if (input.isFailure()) {
            log.warn("Rejected GL batch: {}", input.getError());
            metrics.recordPosting("unknown", input.getError().getCode().name());
            return input;
        }

        VoucherRef voucher = batch.voucherRef();
        if (options.isCancel()) {
            return execute(voucher, "cancel", () -> makeReverseGlEntries(voucher));
        }
        return execute(voucher, "post", () -> makeGlEntries(batch, options));
    }

    public PostingResult<GlBatch> post(GlBatch batch) {
        return post(batch, PostingOptions.defaults());
    }

    /**
     * Reverses all active stored entries of the voucher.
     */
    public PostingResult<GlBatch> cancel(VoucherRef voucher) {
        if (voucher == null || isBlank(voucher.getVoucherType()) || isBlank(voucher.getVoucherNo())) {
            PostingResult<GlBatch> rejected = PostingResult.failure(
                PostingError.invalidBatch("Voucher type and number are required"));
            log.warn("Rejected GL cancellation: {}", rejected.getError());
            metrics.recordPosting("unknown", rejected.getError().getCode().name());
            return rejected;
        }
        return execute(voucher, "cancel", () -> makeReverseGlEntries(voucher));
    }

    private PostingResult<GlBatch> execute(VoucherRef voucher, String operation,
                                           Supplier<PostingResult<GlBatch>> work) {
        long startTime = System.currentTimeMillis();
        PostingContext.begin(voucher);
        log.info("Starting GL {}", operation);

        PostingResult<GlBatch> result;
        try {
            result = transactionOperations.execute(status -> {
                PostingResult<GlBatch> outcome;
                try {
                    outcome = work.get();
                } catch (CollaboratorFailure e) {
                    outcome = PostingResult.failure(e.error);
                }
                if (outcome.isFailure()) {
                    status.setRollbackOnly();
                }
                return outcome;
            });
        } catch (RuntimeException e) {
            log.error("GL {} failed to commit: error={}", operation, e.getMessage());
            result = PostingResult.failure(PostingError.collaboratorFailure("Transaction commit", e));
        } finally {
            PostingContext.end();
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordPostingLatency(operation, duration);

        if (result.isSuccess()) {
            GlBatch saved = result.getValue();
            metrics.recordPosting(voucher.getVoucherType(), "cancel".equals(operation) ? "cancelled" : "posted");
            log.info("GL {} completed for {}: entries={}, debit={}, credit={}, duration={}ms",
                operation, voucher, saved.size(), saved.totalDebit(), saved.totalCredit(), duration);
        } else {
            metrics.recordPosting(voucher.getVoucherType(), result.getError().getCode().name());
            log.warn("GL {} rejected for {}: {}", operation, voucher, result.getError());
        }
        return result;
    }

    // ==================== Posting Path ====================

    private PostingResult<GlBatch> makeGlEntries(GlBatch batch, PostingOptions options) {
        return checkNotAlreadyPosted(batch, options)
            .flatMap(b -> validateBudget(b, options))
            .flatMap(this::makeDimensionOffsettingEntries)
            .flatMap(this::validateAccountingPeriod)
            .flatMap(b -> validateAccounts(b, options))
            .flatMap(this::stampFiscalYear)
            .map(b -> processGlMap(b, options))
            .flatMap(this::validateEntryCount)
            .flatMap(processed -> {
                List<PartyLedgerEntry> partyEntries = createPartyLedgerEntries(processed);
                return processDebitCreditDifference(processed)
                    .flatMap(b -> checkFreezingDate(b, options))
                    .map(this::assignNames)
                    .map(b -> saveEntries(b, partyEntries));
            });
    }

    private PostingResult<GlBatch> checkNotAlreadyPosted(GlBatch batch, PostingOptions options) {
        if (options.isFromRepost()) {
            return PostingResult.success(batch);
        }
        List<GlEntry> stored = call("Load GL entries",
            () -> glEntryStore.getByVoucher(batch.voucherType(), batch.voucherNo()));
        boolean posted = stored.stream().anyMatch(entry -> !entry.isCancelled());
        if (posted) {
            return PostingResult.failure(PostingError.voucherAlreadyPosted(batch.voucherRef()));
        }
        return PostingResult.success(batch);
    }

    private PostingResult<GlBatch> validateBudget(GlBatch batch, PostingOptions options) {
        if (budgetValidator == null || options.isFromRepost()
                || policy.isPeriodClosingVoucher(batch.voucherType())) {
            return PostingResult.success(batch);
        }
        Optional<BudgetViolation> violation = call("Budget validation", () -> budgetValidator.validate(batch));
        if (violation.isPresent()) {
            BudgetViolation v = violation.get();
            return PostingResult.failure(PostingError.budgetExceeded(
                v.getAccount(), v.getCostCenter(), v.getBudget(), v.getActual(), v.getVariance()));
        }
        return PostingResult.success(batch);
    }

    private PostingResult<GlBatch> makeDimensionOffsettingEntries(GlBatch batch) {
        if (dimensionProvider == null || policy.isPeriodClosingVoucher(batch.voucherType())) {
            return PostingResult.success(batch);
        }
        List<AccountingDimension> dimensions = call("Accounting dimension lookup",
            () -> dimensionProvider.getDimensionsForOffsetting(batch, batch.company()));
        if (dimensions.isEmpty()) {
            return PostingResult.success(batch);
        }
        GlBatch offset = dimensionOffsetter.offset(batch, dimensions);
        log.debug("Added {} dimension offsetting entries for {} dimension(s)",
            offset.size() - batch.size(), dimensions.size());
        return PostingResult.success(offset);
    }

    private PostingResult<GlBatch> validateAccountingPeriod(GlBatch batch) {
        if (periodChecker == null) {
            return PostingResult.success(batch);
        }
        String company = batch.company();
        String documentType = batch.voucherType();
        LocalDate postingDate = batch.postingDate();

        boolean closed = call("Accounting period check",
            () -> periodChecker.isDocumentTypeClosed(company, documentType, postingDate));
        if (closed) {
            String periodName = call("Accounting period lookup",
                () -> periodChecker.getClosedPeriodName(company, documentType, postingDate)).orElse("");
            return PostingResult.failure(PostingError.periodClosed(company, documentType, postingDate, periodName));
        }
        return PostingResult.success(batch);
    }

    private PostingResult<GlBatch> validateAccounts(GlBatch batch, PostingOptions options) {
        if (accountLookup == null) {
            return PostingResult.success(batch);
        }

        Map<String, Optional<Account>> accounts = new LinkedHashMap<>();
        for (GlEntry entry : batch.entries()) {
            accounts.computeIfAbsent(entry.getAccount(),
                name -> call("Account lookup", () -> accountLookup.getAccount(name)));
        }

        List<String> disabled = accounts.values().stream()
            .flatMap(Optional::stream)
            .filter(Account::isDisabled)
            .map(Account::getName)
            .toList();
        if (!disabled.isEmpty()) {
            return PostingResult.failure(PostingError.disabledAccounts(disabled));
        }

        for (Map.Entry<String, Optional<Account>> candidate : accounts.entrySet()) {
            if (candidate.getValue().isEmpty()) {
                return PostingResult.failure(PostingError.accountNotFound(candidate.getKey()));
            }
            Account account = candidate.getValue().get();
            if (account.isGroup()) {
                return PostingResult.failure(PostingError.accountIsGroup(account.getName()));
            }
            if (account.isFrozen() && !options.isAdvanceAdjustment()) {
                return PostingResult.failure(PostingError.accountFrozen(account.getName()));
            }
        }

        return validateCurrencies(batch, accounts);
    }

    private PostingResult<GlBatch> validateCurrencies(GlBatch batch, Map<String, Optional<Account>> accounts) {
        String companyCurrency = companySettings != null
            ? call("Company currency lookup", () -> companySettings.getDefaultCurrency(batch.company()))
            : null;

        List<GlEntry> checked = new ArrayList<>(batch.size());
        for (GlEntry candidate : batch.entries()) {
            GlEntry entry = candidate;
            Account account = accounts.get(entry.getAccount()).orElseThrow();
            String expected = account.getAccountCurrency();
            String declared = entry.getAccountCurrency();

            if (declared != null && !declared.isEmpty() && expected != null && !declared.equals(expected)) {
                return PostingResult.failure(
                    PostingError.invalidAccountCurrency(account.getName(), declared, expected));
            }

            if (companyCurrency != null && companyCurrency.equals(expected)) {
                // Company-currency account with no account-currency view: it mirrors the company view.
                if (Amounts.isZero(Amounts.orZero(entry.getDebitInAccountCurrency()), policy.getPrecision())
                        && Amounts.isZero(Amounts.orZero(entry.getCreditInAccountCurrency()), policy.getPrecision())) {
                    entry = entry.toBuilder()
                        .debitInAccountCurrency(Amounts.orZero(entry.getDebit()))
                        .creditInAccountCurrency(Amounts.orZero(entry.getCredit()))
                        .build();
                }
                BigDecimal companyAmount = Amounts.orZero(entry.getDebit()).subtract(Amounts.orZero(entry.getCredit()));
                BigDecimal accountAmount = Amounts.orZero(entry.getDebitInAccountCurrency())
                    .subtract(Amounts.orZero(entry.getCreditInAccountCurrency()));
                if (!Amounts.round(companyAmount, policy.getPrecision())
                        .equals(Amounts.round(accountAmount, policy.getPrecision()))) {
                    return PostingResult.failure(PostingError.currencyMismatch(
                        account.getName(), companyCurrency, companyAmount, accountAmount));
                }
            }
            checked.add(entry);
        }
        return PostingResult.success(GlBatch.of(checked));
    }

    private PostingResult<GlBatch> stampFiscalYear(GlBatch batch) {
        if (fiscalYearLookup == null) {
            return PostingResult.success(batch);
        }
        Map<LocalDate, FiscalYear> resolved = new HashMap<>();
        List<GlEntry> stamped = new ArrayList<>(batch.size());

        for (GlEntry entry : batch.entries()) {
            if (entry.getFiscalYear() != null && !entry.getFiscalYear().isEmpty()) {
                stamped.add(entry);
                continue;
            }
            LocalDate date = entry.getPostingDate();
            FiscalYear fiscalYear = resolved.get(date);
            if (fiscalYear == null) {
                Optional<FiscalYear> found = call("Fiscal year lookup",
                    () -> fiscalYearLookup.findFiscalYear(date, entry.getCompany()));
                if (found.isEmpty()) {
                    return PostingResult.failure(PostingError.fiscalYearNotFound(date, entry.getCompany()));
                }
                fiscalYear = found.get();
                resolved.put(date, fiscalYear);
            }
            stamped.add(entry.toBuilder().fiscalYear(fiscalYear.getName()).build());
        }
        return PostingResult.success(GlBatch.of(stamped));
    }

    private GlBatch processGlMap(GlBatch batch, PostingOptions options) {
        boolean merge = options.isMergeEntries() && !policy.isPeriodClosingVoucher(batch.voucherType());
        Set<String> zeroBalanceAccounts = merge ? zeroBalanceAccounts(batch.company()) : Set.of();
        GlBatch processed = processor.process(batch, merge, zeroBalanceAccounts);
        log.debug("Processed GL map: {} entries in, {} out (merge={})", batch.size(), processed.size(), merge);
        return processed;
    }

    private Set<String> zeroBalanceAccounts(String company) {
        if (companySettings == null) {
            return Set.of();
        }
        return call("Exchange gain/loss account lookup", () -> companySettings.getExchangeGainLossAccount(company))
            .map(Set::of)
            .orElse(Set.of());
    }

    private PostingResult<GlBatch> validateEntryCount(GlBatch batch) {
        if (batch.size() < MIN_ENTRIES) {
            return PostingResult.failure(PostingError.insufficientEntries(MIN_ENTRIES, batch.size()));
        }
        return PostingResult.success(batch);
    }

    // Derived from the processed batch; written only once every check has passed.
    private List<PartyLedgerEntry> createPartyLedgerEntries(GlBatch batch) {
        if (partyLedgerStore == null || policy.isPeriodClosingVoucher(batch.voucherType())) {
            return List.of();
        }
        return batch.stream()
            .filter(GlEntry::hasParty)
            .map(PartyLedgerEntry::fromGlEntry)
            .toList();
    }

    private PostingResult<GlBatch> processDebitCreditDifference(GlBatch batch) {
        return reconciler.check(batch).map(difference -> {
            if (difference.isEmpty()) {
                return batch;
            }
            Optional<RoundOffTarget> target = roundOffTarget(batch.company());
            if (target.isEmpty()) {
                log.debug("No round-off account configured; leaving difference {} unresolved",
                    difference.get());
                return batch;
            }
            metrics.recordRoundOff(batch.voucherType());
            return reconciler.appendRoundOff(batch, difference.get(), target.get());
        });
    }

    private Optional<RoundOffTarget> roundOffTarget(String company) {
        if (companySettings == null) {
            return Optional.empty();
        }
        Optional<String> account = call("Round-off account lookup", () -> companySettings.getRoundOffAccount(company));
        if (account.isEmpty() || account.get().isEmpty()) {
            return Optional.empty();
        }
        String costCenter = call("Round-off cost center lookup",
            () -> companySettings.getRoundOffCostCenter(company)).orElse(null);
        String currency = call("Company currency lookup", () -> companySettings.getDefaultCurrency(company));
        return Optional.of(new RoundOffTarget(account.get(), costCenter, currency));
    }

    private PostingResult<GlBatch> checkFreezingDate(GlBatch batch, PostingOptions options) {
        if (companySettings == null) {
            return PostingResult.success(batch);
        }
        String company = batch.company();
        LocalDate postingDate = batch.postingDate();

        Optional<LocalDate> booksClosedTill = call("Books closing date lookup",
            () -> companySettings.getBooksClosedTillDate(company));
        if (booksClosedTill.isPresent() && !postingDate.isAfter(booksClosedTill.get())) {
            return PostingResult.failure(PostingError.booksClosed(booksClosedTill.get(), postingDate));
        }

        if (!options.isAdvanceAdjustment()) {
            Optional<LocalDate> frozenTill = call("Accounts frozen date lookup",
                () -> companySettings.getAccountsFrozenTillDate(company));
            if (frozenTill.isPresent() && postingDate.isBefore(frozenTill.get())) {
                return PostingResult.failure(PostingError.accountsFrozenTill(frozenTill.get(), postingDate));
            }
        }
        return PostingResult.success(batch);
    }

    private GlBatch assignNames(GlBatch batch) {
        return batch.map(entry -> entry.getName() == null || entry.getName().isEmpty()
            ? entry.toBuilder().name(newEntryName()).build()
            : entry);
    }

    private GlBatch saveEntries(GlBatch batch, List<PartyLedgerEntry> partyEntries) {
        if (!partyEntries.isEmpty()) {
            run("Party ledger save", () -> partyLedgerStore.saveBatch(partyEntries));
            log.debug("Saved {} party ledger entries", partyEntries.size());
        }
        run("GL entry save", () -> glEntryStore.saveBatch(batch.entries()));
        metrics.recordEntriesPersisted(batch.voucherType(), batch.size());
        return batch;
    }

    // ==================== Cancellation Path ====================

    private PostingResult<GlBatch> makeReverseGlEntries(VoucherRef voucher) {
        String voucherType = voucher.getVoucherType();
        String voucherNo = voucher.getVoucherNo();

        List<GlEntry> active = call("Load GL entries", () -> glEntryStore.getByVoucher(voucherType, voucherNo))
            .stream()
            .filter(entry -> !entry.isCancelled())
            .toList();
        if (active.isEmpty()) {
            return PostingResult.failure(PostingError.voucherNotFound(voucher));
        }

        GlBatch reversal = GlBatch.of(active)
            .reversed(policy.getReversalRemarkPrefix())
            .map(entry -> entry.toBuilder().name(newEntryName()).cancelled(true).build());

        run("GL entry cancellation", () -> glEntryStore.cancel(voucherType, voucherNo, reversal.entries()));

        if (partyLedgerStore != null && !policy.isPeriodClosingVoucher(voucherType)) {
            run("Party ledger delink", () -> partyLedgerStore.delink(voucherType, voucherNo));
        }

        metrics.recordEntriesPersisted(voucherType, reversal.size());
        return PostingResult.success(reversal);
    }

    // ==================== Helpers ====================

    private PostingResult<GlBatch> validateInput(GlBatch batch, PostingOptions options) {
        if (batch == null || batch.isEmpty()) {
            return PostingResult.failure(PostingError.invalidBatch("GL batch cannot be empty"));
        }
        Set<String> vouchers = new LinkedHashSet<>();
        for (GlEntry entry : batch.entries()) {
            if (isBlank(entry.getVoucherType()) || isBlank(entry.getVoucherNo())) {
                return PostingResult.failure(PostingError.invalidBatch("Voucher type and number are required"));
            }
            if (!options.isCancel() && isBlank(entry.getAccount())) {
                return PostingResult.failure(PostingError.invalidBatch(
                    "Account is required for every entry of " + entry.voucherRef()));
            }
            if (!options.isCancel() && entry.getPostingDate() == null) {
                return PostingResult.failure(PostingError.invalidBatch(
                    "Posting date is required for every entry of " + entry.voucherRef()));
            }
            vouchers.add(entry.getVoucherType() + " #" + entry.getVoucherNo());
        }
        if (vouchers.size() > 1) {
            return PostingResult.failure(PostingError.invalidBatch(
                "GL batch mixes vouchers: " + String.join(", ", vouchers)));
        }
        return PostingResult.success(batch);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String newEntryName() {
        return ENTRY_NAME_PREFIX + UUID.randomUUID();
    }

    private <T> T call(String operation, Supplier<T> collaboratorCall) {
        try {
            return collaboratorCall.get();
        } catch (RuntimeException e) {
            log.error("{} failed: error={}", operation, e.getMessage());
            throw new CollaboratorFailure(PostingError.collaboratorFailure(operation, e));
        }
    }

    private void run(String operation, Runnable collaboratorCall) {
        call(operation, () -> {
            collaboratorCall.run();
            return null;
        });
    }

    /**
     * Carries a wrapped collaborator error out of a step to the transaction boundary.
     */
    private static final class CollaboratorFailure extends RuntimeException {
        private final transient PostingError error;

        private CollaboratorFailure(PostingError error) {
            super(error.getMessage(), error.getCause(), false, false);
            this.error = error;
        }
    }
}
