package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.error.PostingErrorCode;
import com.flagship.general_ledger.ledger.jdbc.JdbcAccountLookup;
import com.flagship.general_ledger.ledger.port.Account;
import com.flagship.general_ledger.ledger.port.GlEntryStore;
import com.flagship.general_ledger.ledger.port.PartyLedgerStore;
import com.flagship.general_ledger.observability.LedgerHealthIndicator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end posting tests against PostgreSQL.
 *
 * Each test creates its own company, chart of accounts and fiscal year so
 * tests never see each other's vouchers. These tests verify:
 * - Posted entries are stored with names, fiscal year and party ledger rows
 * - A rejected posting leaves nothing behind, party ledger included
 * - Cancellation reverses the voucher and delinks its party ledger rows
 * - Period, budget and dimension configuration are read from the database
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class GeneralLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("general_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final LocalDate POSTING_DATE = LocalDate.of(2024, 3, 15);

    @Autowired
    private GeneralLedgerEngine engine;

    @Autowired
    private GlEntryStore glEntryStore;

    @Autowired
    private PartyLedgerStore partyLedgerStore;

    @Autowired
    private JdbcAccountLookup accountLookup;

    @Autowired
    private LedgerHealthIndicator ledgerHealth;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String company;
    private String debtors;
    private String sales;
    private String cash;
    private String roundOff;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        company = "Acme " + suffix;
        debtors = "Debtors - " + suffix;
        sales = "Sales - " + suffix;
        cash = "Cash - " + suffix;
        roundOff = "Round Off - " + suffix;

        jdbcTemplate.update(
            "INSERT INTO companies (name, default_currency, round_off_account, round_off_cost_center) " +
            "VALUES (?, ?, ?, ?)",
            company, "USD", roundOff, "Main - " + suffix
        );
        jdbcTemplate.update(
            "INSERT INTO fiscal_years (name, company, year_start_date, year_end_date) VALUES (?, ?, ?, ?)",
            "FY-2024", company, Date.valueOf("2024-01-01"), Date.valueOf("2024-12-31")
        );
        createAccount(debtors, Account.RootType.ASSET, false);
        createAccount(sales, Account.RootType.INCOME, false);
        createAccount(cash, Account.RootType.ASSET, false);
        createAccount(roundOff, Account.RootType.EXPENSE, false);
    }

    private void createAccount(String name, Account.RootType rootType, boolean disabled) {
        accountLookup.createAccount(Account.builder()
            .name(name)
            .company(company)
            .accountCurrency("USD")
            .rootType(rootType)
            .disabled(disabled)
            .build());
    }

    private GlEntry.GlEntryBuilder entry(String voucherType, String voucherNo, String account,
                                         String debit, String credit) {
        return GlEntry.builder()
            .postingDate(POSTING_DATE)
            .company(company)
            .voucherType(voucherType)
            .voucherNo(voucherNo)
            .account(account)
            .debit(new BigDecimal(debit))
            .credit(new BigDecimal(credit))
            .debitInAccountCurrency(new BigDecimal(debit))
            .creditInAccountCurrency(new BigDecimal(credit));
    }

    private GlBatch invoice(String voucherNo, String debit, String credit) {
        return GlBatch.of(
            entry("Sales Invoice", voucherNo, debtors, debit, "0").partyType("Customer").party("CUST-1").build(),
            entry("Sales Invoice", voucherNo, sales, "0", credit).build()
        );
    }

    private int countRows(String table, String voucherNo) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE voucher_no = ?", Integer.class, voucherNo);
        return count != null ? count : 0;
    }

    private static String newVoucherNo() {
        return "SINV-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Balanced invoice is stored with fiscal year and party ledger row")
    void testPostInvoice() {
        printTestHeader("Post Balanced Invoice");
        String voucherNo = newVoucherNo();
        GlBatch batch = invoice(voucherNo, "11800", "11800");
        printInput("Batch", batch.size() + " entries, debit " + batch.totalDebit());

        PostingResult<GlBatch> result = engine.post(batch);
        printOutput("Result", result);

        assertTrue(result.isSuccess(), () -> result.toString());
        List<GlEntry> stored = glEntryStore.getByVoucher("Sales Invoice", voucherNo);
        assertEquals(2, stored.size());
        assertEquals(debtors, stored.get(0).getAccount());
        assertEquals(0, new BigDecimal("11800").compareTo(stored.get(0).getDebit()));
        assertEquals("FY-2024", stored.get(0).getFiscalYear());
        assertTrue(stored.get(0).getName().startsWith("ACC-GLE-"));
        assertFalse(stored.get(0).isCancelled());

        List<PartyLedgerEntry> partyEntries = partyLedgerStore.getByVoucher("Sales Invoice", voucherNo);
        assertEquals(1, partyEntries.size());
        assertEquals(0, new BigDecimal("11800").compareTo(partyEntries.get(0).getAmount()));
        printSuccess("Invoice stored with " + stored.size() + " GL entries");
    }

    @Test
    @DisplayName("Small difference is stored with a round-off entry")
    void testRoundOff() {
        printTestHeader("Round Off");
        String voucherNo = newVoucherNo();

        PostingResult<GlBatch> result = engine.post(invoice(voucherNo, "100.30", "100"));
        printOutput("Result", result);

        assertTrue(result.isSuccess(), () -> result.toString());
        List<GlEntry> stored = glEntryStore.getByVoucher("Sales Invoice", voucherNo);
        assertEquals(3, stored.size());
        GlEntry roundOffEntry = stored.get(2);
        assertEquals(roundOff, roundOffEntry.getAccount());
        assertEquals(0, new BigDecimal("0.30").compareTo(roundOffEntry.getCredit()));
        assertTrue(GlBatch.of(stored).isBalanced());
        printSuccess("Round-off entry absorbed 0.30");
    }

    @Test
    @DisplayName("Rejected posting leaves no GL or party ledger rows")
    void testRejectedPostingIsAtomic() {
        printTestHeader("Rejected Posting Is Atomic");
        String voucherNo = newVoucherNo();
        GlBatch batch = GlBatch.of(
            entry("Journal Entry", voucherNo, debtors, "101", "0").partyType("Customer").party("CUST-1").build(),
            entry("Journal Entry", voucherNo, sales, "0", "100").build()
        );

        PostingResult<GlBatch> result = engine.post(batch);
        printOutput("Error", result.getError());

        assertEquals(PostingErrorCode.DEBIT_CREDIT_MISMATCH, result.getError().getCode());
        assertEquals(0, countRows("gl_entries", voucherNo));
        assertEquals(0, countRows("payment_ledger_entries", voucherNo));
        printSuccess("No rows persisted");
    }

    @Test
    @DisplayName("Disabled account is reported and nothing is stored")
    void testDisabledAccount() {
        printTestHeader("Disabled Account");
        String oldCash = "Old " + cash;
        createAccount(oldCash, Account.RootType.ASSET, true);
        String voucherNo = newVoucherNo();
        GlBatch batch = GlBatch.of(
            entry("Journal Entry", voucherNo, cash, "100", "0").build(),
            entry("Journal Entry", voucherNo, oldCash, "0", "60").build(),
            entry("Journal Entry", voucherNo, sales, "0", "40").build()
        );

        PostingResult<GlBatch> result = engine.post(batch);
        printOutput("Error", result.getError());

        assertEquals(PostingErrorCode.ACCOUNT_DISABLED, result.getError().getCode());
        assertEquals(oldCash, result.getError().detail("accounts"));
        assertEquals(0, countRows("gl_entries", voucherNo));
    }

    @Test
    @DisplayName("Cancellation reverses the voucher and delinks the party ledger")
    void testCancel() {
        printTestHeader("Cancel Voucher");
        String voucherNo = newVoucherNo();
        assertTrue(engine.post(invoice(voucherNo, "500", "500")).isSuccess());

        PostingResult<GlBatch> result = engine.cancel(new VoucherRef("Sales Invoice", voucherNo, company));
        printOutput("Result", result);

        assertTrue(result.isSuccess(), () -> result.toString());
        List<GlEntry> stored = glEntryStore.getByVoucher("Sales Invoice", voucherNo);
        assertEquals(4, stored.size());
        assertTrue(stored.stream().allMatch(GlEntry::isCancelled));
        BigDecimal net = stored.stream()
            .map(e -> e.getDebit().subtract(e.getCredit()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, net.signum());
        assertTrue(partyLedgerStore.getByVoucher("Sales Invoice", voucherNo).stream()
            .allMatch(PartyLedgerEntry::isDelinked));

        PostingResult<GlBatch> again = engine.cancel(new VoucherRef("Sales Invoice", voucherNo, company));
        assertEquals(PostingErrorCode.VOUCHER_NOT_FOUND, again.getError().getCode());
        printSuccess("Voucher reversed, second cancel rejected");
    }

    @Test
    @DisplayName("Posting the same voucher twice is rejected")
    void testDuplicateVoucher() {
        printTestHeader("Duplicate Voucher");
        String voucherNo = newVoucherNo();
        assertTrue(engine.post(invoice(voucherNo, "10", "10")).isSuccess());

        PostingResult<GlBatch> result = engine.post(invoice(voucherNo, "10", "10"));

        assertEquals(PostingErrorCode.VOUCHER_ALREADY_POSTED, result.getError().getCode());
        assertEquals(2, countRows("gl_entries", voucherNo));
    }

    @Test
    @DisplayName("Closed accounting period blocks the document type")
    void testClosedPeriod() {
        printTestHeader("Closed Accounting Period");
        String period = "Mar-2024 " + company;
        jdbcTemplate.update(
            "INSERT INTO accounting_periods (name, company, start_date, end_date) VALUES (?, ?, ?, ?)",
            period, company, Date.valueOf("2024-03-01"), Date.valueOf("2024-03-31")
        );
        jdbcTemplate.update(
            "INSERT INTO accounting_period_closed_documents (period_name, document_type, closed) VALUES (?, ?, TRUE)",
            period, "Sales Invoice"
        );

        PostingResult<GlBatch> result = engine.post(invoice(newVoucherNo(), "10", "10"));
        printOutput("Error", result.getError());

        assertEquals(PostingErrorCode.PERIOD_CLOSED, result.getError().getCode());
        assertEquals(period, result.getError().detail("period"));
    }

    @Test
    @DisplayName("Budget is checked against posted and new spend")
    void testBudgetExceeded() {
        printTestHeader("Budget Exceeded");
        String travel = "Travel - " + company;
        String costCenter = "Main - " + company;
        createAccount(travel, Account.RootType.EXPENSE, false);
        jdbcTemplate.update(
            "INSERT INTO budgets (company, fiscal_year, account, cost_center, budget_amount) VALUES (?, ?, ?, ?, ?)",
            company, "FY-2024", travel, costCenter, new BigDecimal("1000")
        );

        String first = newVoucherNo();
        assertTrue(engine.post(GlBatch.of(
            entry("Journal Entry", first, travel, "800", "0").costCenter(costCenter).build(),
            entry("Journal Entry", first, cash, "0", "800").build()
        )).isSuccess());

        String second = newVoucherNo();
        PostingResult<GlBatch> result = engine.post(GlBatch.of(
            entry("Journal Entry", second, travel, "300", "0").costCenter(costCenter).build(),
            entry("Journal Entry", second, cash, "0", "300").build()
        ));
        printOutput("Error", result.getError());

        assertEquals(PostingErrorCode.BUDGET_EXCEEDED, result.getError().getCode());
        assertEquals(0, new BigDecimal("1100").compareTo(new BigDecimal(result.getError().detail("actual"))));
        assertEquals(0, new BigDecimal("100").compareTo(new BigDecimal(result.getError().detail("variance"))));
    }

    @Test
    @DisplayName("Dimension spanning several values gets offsetting entries")
    void testDimensionOffsetting() {
        printTestHeader("Dimension Offsetting");
        String interSegment = "Inter Segment - " + company;
        createAccount(interSegment, Account.RootType.ASSET, false);
        jdbcTemplate.update(
            "INSERT INTO accounting_dimensions (name, company, fieldname, offsetting_account, account_currency, " +
            "automatically_post_balancing_entry) VALUES (?, ?, ?, ?, ?, TRUE)",
            "Segment", company, "cost_center", interSegment, "USD"
        );
        String voucherNo = newVoucherNo();

        PostingResult<GlBatch> result = engine.post(GlBatch.of(
            entry("Journal Entry", voucherNo, cash, "100", "0").costCenter("East").build(),
            entry("Journal Entry", voucherNo, sales, "0", "100").costCenter("West").build()
        ));

        assertTrue(result.isSuccess(), () -> result.toString());
        List<GlEntry> stored = glEntryStore.getByVoucher("Journal Entry", voucherNo);
        assertEquals(4, stored.size());
        assertEquals(2, stored.stream().filter(e -> e.getAccount().equals(interSegment)).count());
        assertTrue(GlBatch.of(stored).isBalanced());
    }

    @Test
    @DisplayName("Ledger health is up when every voucher balances")
    void testLedgerHealth() {
        assertTrue(engine.post(invoice(newVoucherNo(), "42", "42")).isSuccess());

        assertEquals(Status.UP, ledgerHealth.health().getStatus());
        assertEquals(0L, ledgerHealth.health().getDetails().get("unbalancedVouchers"));
    }
}
