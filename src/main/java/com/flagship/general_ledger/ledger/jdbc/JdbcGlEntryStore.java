package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.Amounts;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.port.GlEntryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * JDBC-backed GL entry store.
 *
 * Rows are only ever inserted, apart from the is_cancelled flag set on cancellation.
 * The database rejects negative debit or credit (chk_gl_entries_non_negative).
 */
@Repository
@Slf4j
public class JdbcGlEntryStore implements GlEntryStore {

    private static final String INSERT_SQL =
        "INSERT INTO gl_entries (name, posting_date, due_date, company, fiscal_year, " +
        "voucher_type, voucher_no, voucher_subtype, voucher_detail_no, account, account_currency, " +
        "party_type, party, against_voucher_type, against_voucher, debit, credit, " +
        "debit_in_account_currency, credit_in_account_currency, transaction_currency, " +
        "transaction_exchange_rate, debit_in_transaction_currency, credit_in_transaction_currency, " +
        "cost_center, project, finance_book, is_opening, is_advance, is_cancelled, remarks) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_SQL =
        "SELECT name, posting_date, due_date, company, fiscal_year, voucher_type, voucher_no, " +
        "voucher_subtype, voucher_detail_no, account, account_currency, party_type, party, " +
        "against_voucher_type, against_voucher, debit, credit, debit_in_account_currency, " +
        "credit_in_account_currency, transaction_currency, transaction_exchange_rate, " +
        "debit_in_transaction_currency, credit_in_transaction_currency, cost_center, project, " +
        "finance_book, is_opening, is_advance, is_cancelled, remarks FROM gl_entries ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcGlEntryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void saveBatch(List<GlEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate(INSERT_SQL, entries, entries.size(), this::bindEntry);
        log.debug("Saved {} GL entries", entries.size());
    }

    @Override
    @Transactional(readOnly = true)
    public List<GlEntry> getByVoucher(String voucherType, String voucherNo) {
        return jdbcTemplate.query(
            SELECT_SQL + "WHERE voucher_type = ? AND voucher_no = ? ORDER BY sequence_number",
            glEntryRowMapper(),
            voucherType,
            voucherNo
        );
    }

    @Override
    @Transactional
    public void markCancelled(String voucherType, String voucherNo) {
        int updated = jdbcTemplate.update(
            "UPDATE gl_entries SET is_cancelled = TRUE " +
            "WHERE voucher_type = ? AND voucher_no = ? AND is_cancelled = FALSE",
            voucherType,
            voucherNo
        );
        log.debug("Marked {} GL entries cancelled for {} #{}", updated, voucherType, voucherNo);
    }

    @Override
    @Transactional
    public void cancel(String voucherType, String voucherNo, List<GlEntry> reversal) {
        markCancelled(voucherType, voucherNo);
        saveBatch(reversal);
    }

    /**
     * Counts vouchers whose active entries are out of balance by more than the tolerance.
     * Used by the ledger health check.
     */
    @Transactional(readOnly = true)
    public long countUnbalancedVouchers(BigDecimal tolerance) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (" +
            "  SELECT voucher_type, voucher_no FROM gl_entries WHERE is_cancelled = FALSE " +
            "  GROUP BY voucher_type, voucher_no " +
            "  HAVING ABS(SUM(debit) - SUM(credit)) > ?" +
            ") unbalanced",
            Long.class,
            tolerance
        );
        return count != null ? count : 0L;
    }

    private void bindEntry(PreparedStatement ps, GlEntry entry) throws SQLException {
        ps.setString(1, entry.getName());
        ps.setDate(2, Date.valueOf(entry.getPostingDate()));
        ps.setDate(3, entry.getDueDate() != null ? Date.valueOf(entry.getDueDate()) : null);
        ps.setString(4, entry.getCompany());
        ps.setString(5, entry.getFiscalYear());
        ps.setString(6, entry.getVoucherType());
        ps.setString(7, entry.getVoucherNo());
        ps.setString(8, entry.getVoucherSubtype());
        ps.setString(9, entry.getVoucherDetailNo());
        ps.setString(10, entry.getAccount());
        ps.setString(11, entry.getAccountCurrency());
        ps.setString(12, entry.getPartyType());
        ps.setString(13, entry.getParty());
        ps.setString(14, entry.getAgainstVoucherType());
        ps.setString(15, entry.getAgainstVoucher());
        ps.setBigDecimal(16, Amounts.orZero(entry.getDebit()));
        ps.setBigDecimal(17, Amounts.orZero(entry.getCredit()));
        ps.setBigDecimal(18, Amounts.orZero(entry.getDebitInAccountCurrency()));
        ps.setBigDecimal(19, Amounts.orZero(entry.getCreditInAccountCurrency()));
        ps.setString(20, entry.getTransactionCurrency());
        ps.setBigDecimal(21, entry.getTransactionExchangeRate() != null ? entry.getTransactionExchangeRate() : BigDecimal.ONE);
        ps.setBigDecimal(22, Amounts.orZero(entry.getDebitInTransactionCurrency()));
        ps.setBigDecimal(23, Amounts.orZero(entry.getCreditInTransactionCurrency()));
        ps.setString(24, entry.getCostCenter());
        ps.setString(25, entry.getProject());
        ps.setString(26, entry.getFinanceBook());
        ps.setBoolean(27, entry.isOpening());
        ps.setBoolean(28, entry.isAdvance());
        ps.setBoolean(29, entry.isCancelled());
        ps.setString(30, entry.getRemarks());
    }

    private RowMapper<GlEntry> glEntryRowMapper() {
        return (rs, rowNum) -> {
            Date dueDate = rs.getDate("due_date");
            return GlEntry.builder()
                .name(rs.getString("name"))
                .postingDate(rs.getDate("posting_date").toLocalDate())
                .dueDate(dueDate != null ? dueDate.toLocalDate() : null)
                .company(rs.getString("company"))
                .fiscalYear(rs.getString("fiscal_year"))
                .voucherType(rs.getString("voucher_type"))
                .voucherNo(rs.getString("voucher_no"))
                .voucherSubtype(rs.getString("voucher_subtype"))
                .voucherDetailNo(rs.getString("voucher_detail_no"))
                .account(rs.getString("account"))
                .accountCurrency(rs.getString("account_currency"))
                .partyType(rs.getString("party_type"))
                .party(rs.getString("party"))
                .againstVoucherType(rs.getString("against_voucher_type"))
                .againstVoucher(rs.getString("against_voucher"))
                .debit(rs.getBigDecimal("debit"))
                .credit(rs.getBigDecimal("credit"))
                .debitInAccountCurrency(rs.getBigDecimal("debit_in_account_currency"))
                .creditInAccountCurrency(rs.getBigDecimal("credit_in_account_currency"))
                .transactionCurrency(rs.getString("transaction_currency"))
                .transactionExchangeRate(rs.getBigDecimal("transaction_exchange_rate"))
                .debitInTransactionCurrency(rs.getBigDecimal("debit_in_transaction_currency"))
                .creditInTransactionCurrency(rs.getBigDecimal("credit_in_transaction_currency"))
                .costCenter(rs.getString("cost_center"))
                .project(rs.getString("project"))
                .financeBook(rs.getString("finance_book"))
                .opening(rs.getBoolean("is_opening"))
                .advance(rs.getBoolean("is_advance"))
                .cancelled(rs.getBoolean("is_cancelled"))
                .remarks(rs.getString("remarks"))
                .build();
        };
    }
}
