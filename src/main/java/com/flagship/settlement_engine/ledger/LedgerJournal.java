package com.flagship.settlement_engine.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to balance records, the custody total and the entry journal.
 *
 * Every balance update is a single conditional UPDATE, so the non-negative checks on the
 * tables are never the first line of defence. Callers own the transaction.
 */
@Repository
public class LedgerJournal {

    static final String CUSTODY_ID = "ENGINE";

    private final JdbcTemplate jdbcTemplate;

    public LedgerJournal(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void addAvailable(String accountId, BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_accounts SET available_balance = available_balance + ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE account_id = ?",
            amount, accountId);
        if (updated == 0) {
            insertAccount(accountId, amount, BigDecimal.ZERO);
        }
    }

    /**
     * @return false (and no change) if the account cannot cover the amount
     */
    public boolean subtractAvailable(String accountId, BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_accounts SET available_balance = available_balance - ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE account_id = ? AND available_balance >= ?",
            amount, accountId, amount);
        return updated == 1;
    }

    public void addPending(String accountId, BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_accounts SET pending_withdrawal = pending_withdrawal + ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE account_id = ?",
            amount, accountId);
        if (updated == 0) {
            insertAccount(accountId, BigDecimal.ZERO, amount);
        }
    }

    /**
     * Sets the pending balance to zero and returns what it was.
     */
    public BigDecimal clearPending(String accountId) {
        BigDecimal pending = findBalance(accountId)
            .map(AccountBalance::getPendingWithdrawal)
            .orElse(BigDecimal.ZERO);
        if (pending.signum() > 0) {
            jdbcTemplate.update(
                "UPDATE ledger_accounts SET pending_withdrawal = 0, " +
                "updated_at = CURRENT_TIMESTAMP WHERE account_id = ?",
                accountId);
        }
        return pending;
    }

    public void addCustody(BigDecimal amount) {
        jdbcTemplate.update(
            "UPDATE ledger_custody SET balance = balance + ? WHERE id = ?",
            amount, CUSTODY_ID);
    }

    public void subtractCustody(BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_custody SET balance = balance - ? WHERE id = ? AND balance >= ?",
            amount, CUSTODY_ID, amount);
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Custody cannot cover %s: custody=%s", amount, getCustodyBalance()));
        }
    }

    public void record(String accountId, Bucket bucket, EntryType entryType,
                       BigDecimal amount, String description) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (account_id, bucket, entry_type, amount, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            bucket.name(),
            entryType.name(),
            amount,
            description
        );
    }

    public void recordCustody(EntryType entryType, BigDecimal amount, String description) {
        record(CUSTODY_ID, Bucket.CUSTODY, entryType, amount, description);
    }

    public Optional<AccountBalance> findBalance(String accountId) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT account_id, available_balance, pending_withdrawal FROM ledger_accounts WHERE account_id = ?",
            (rs, rowNum) -> new AccountBalance(
                rs.getString("account_id"),
                rs.getBigDecimal("available_balance"),
                rs.getBigDecimal("pending_withdrawal")
            ),
            accountId
        );
        return rows.stream().findFirst();
    }

    public BigDecimal getCustodyBalance() {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT balance FROM ledger_custody WHERE id = ?",
            BigDecimal.class,
            CUSTODY_ID
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    public BigDecimal getTotalPending() {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(pending_withdrawal), 0) FROM ledger_accounts",
            BigDecimal.class
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    public List<LedgerEntry> findEntries(String accountId) {
        return jdbcTemplate.query(
            "SELECT sequence_number, account_id, bucket, entry_type, amount, description, created_at " +
            "FROM ledger_entries WHERE account_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            accountId
        );
    }

    private void insertAccount(String accountId, BigDecimal available, BigDecimal pending) {
        jdbcTemplate.update(
            "INSERT INTO ledger_accounts (account_id, available_balance, pending_withdrawal, created_at, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            accountId, available, pending);
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getLong("sequence_number"),
            rs.getString("account_id"),
            Bucket.valueOf(rs.getString("bucket")),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getBigDecimal("amount"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
