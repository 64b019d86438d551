package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.PartyLedgerEntry;
import com.flagship.general_ledger.ledger.port.PartyLedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Date;
import java.util.List;

/**
 * JDBC-backed receivable / payable ledger.
 */
@Repository
@ConditionalOnProperty(name = "ledger.party-ledger.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class JdbcPartyLedgerStore implements PartyLedgerStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcPartyLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void saveBatch(List<PartyLedgerEntry> entries) {
        jdbcTemplate.batchUpdate(
            "INSERT INTO payment_ledger_entries (posting_date, company, account, party_type, party, " +
            "voucher_type, voucher_no, voucher_detail_no, against_voucher_type, against_voucher_no, " +
            "account_currency, amount, amount_in_account_currency, due_date, finance_book, delinked) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entries,
            entries.size(),
            (ps, entry) -> {
                ps.setDate(1, Date.valueOf(entry.getPostingDate()));
                ps.setString(2, entry.getCompany());
                ps.setString(3, entry.getAccount());
                ps.setString(4, entry.getPartyType());
                ps.setString(5, entry.getParty());
                ps.setString(6, entry.getVoucherType());
                ps.setString(7, entry.getVoucherNo());
                ps.setString(8, entry.getVoucherDetailNo());
                ps.setString(9, entry.getAgainstVoucherType());
                ps.setString(10, entry.getAgainstVoucherNo());
                ps.setString(11, entry.getAccountCurrency());
                ps.setBigDecimal(12, entry.getAmount());
                ps.setBigDecimal(13, entry.getAmountInAccountCurrency());
                ps.setDate(14, entry.getDueDate() != null ? Date.valueOf(entry.getDueDate()) : null);
                ps.setString(15, entry.getFinanceBook());
                ps.setBoolean(16, entry.isDelinked());
            }
        );
        log.debug("Saved {} party ledger entries", entries.size());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PartyLedgerEntry> getByVoucher(String voucherType, String voucherNo) {
        return jdbcTemplate.query(
            "SELECT posting_date, company, account, party_type, party, voucher_type, voucher_no, " +
            "voucher_detail_no, against_voucher_type, against_voucher_no, account_currency, amount, " +
            "amount_in_account_currency, due_date, finance_book, delinked " +
            "FROM payment_ledger_entries WHERE voucher_type = ? AND voucher_no = ? ORDER BY id",
            partyLedgerEntryRowMapper(),
            voucherType,
            voucherNo
        );
    }

    @Override
    @Transactional
    public void delink(String voucherType, String voucherNo) {
        int updated = jdbcTemplate.update(
            "UPDATE payment_ledger_entries SET delinked = TRUE WHERE voucher_type = ? AND voucher_no = ?",
            voucherType,
            voucherNo
        );
        log.debug("Delinked {} party ledger entries for {} #{}", updated, voucherType, voucherNo);
    }

    private RowMapper<PartyLedgerEntry> partyLedgerEntryRowMapper() {
        return (rs, rowNum) -> {
            Date dueDate = rs.getDate("due_date");
            return PartyLedgerEntry.builder()
                .postingDate(rs.getDate("posting_date").toLocalDate())
                .company(rs.getString("company"))
                .account(rs.getString("account"))
                .partyType(rs.getString("party_type"))
                .party(rs.getString("party"))
                .voucherType(rs.getString("voucher_type"))
                .voucherNo(rs.getString("voucher_no"))
                .voucherDetailNo(rs.getString("voucher_detail_no"))
                .againstVoucherType(rs.getString("against_voucher_type"))
                .againstVoucherNo(rs.getString("against_voucher_no"))
                .accountCurrency(rs.getString("account_currency"))
                .amount(rs.getBigDecimal("amount"))
                .amountInAccountCurrency(rs.getBigDecimal("amount_in_account_currency"))
                .dueDate(dueDate != null ? dueDate.toLocalDate() : null)
                .financeBook(rs.getString("finance_book"))
                .delinked(rs.getBoolean("delinked"))
                .build();
        };
    }
}
