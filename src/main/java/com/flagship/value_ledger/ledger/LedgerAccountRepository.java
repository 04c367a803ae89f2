package com.flagship.value_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to ledger_accounts.
 *
 * The locking reads ({@code FOR UPDATE}) must run inside a transaction; they are
 * how the ledger serializes concurrent mutations on the same account.
 */
@Repository
public class LedgerAccountRepository {

    private static final String COLUMNS =
        "id, owner_id, ledger_type, balance, lifetime_inflow, tier_points, tier, created_at, updated_at, archived_at";

    private final JdbcTemplate jdbcTemplate;

    public LedgerAccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts an empty account unless one already exists for the owner and type.
     * Safe under concurrency: the loser of a race waits on the unique key and inserts nothing.
     */
    public void insertIfAbsent(UUID ownerId, LedgerType ledgerType, String initialTier) {
        jdbcTemplate.update(
            "INSERT INTO ledger_accounts (id, owner_id, ledger_type, balance, lifetime_inflow, tier_points, tier) " +
            "VALUES (?, ?, ?, 0, 0, 0, ?) " +
            "ON CONFLICT ON CONSTRAINT uq_ledger_accounts_owner_type DO NOTHING",
            UUID.randomUUID(),
            ownerId,
            ledgerType.name(),
            initialTier
        );
    }

    public Optional<LedgerAccount> findById(UUID accountId) {
        return single(jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_accounts WHERE id = ?",
            accountRowMapper(), accountId));
    }

    public Optional<LedgerAccount> findByOwner(UUID ownerId, LedgerType ledgerType) {
        return single(jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_accounts WHERE owner_id = ? AND ledger_type = ?",
            accountRowMapper(), ownerId, ledgerType.name()));
    }

    public Optional<LedgerAccount> lockById(UUID accountId) {
        return single(jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_accounts WHERE id = ? FOR UPDATE",
            accountRowMapper(), accountId));
    }

    public Optional<LedgerAccount> lockByOwner(UUID ownerId, LedgerType ledgerType) {
        return single(jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_accounts WHERE owner_id = ? AND ledger_type = ? FOR UPDATE",
            accountRowMapper(), ownerId, ledgerType.name()));
    }

    /**
     * Applies a delta and returns the row as stored afterwards.
     * The CHECK constraint on balance is the last line of defence against overdraft.
     */
    public LedgerAccount applyDelta(UUID accountId, long delta, long tierPointsDelta) {
        long inflow = Math.max(delta, 0);
        return jdbcTemplate.queryForObject(
            "UPDATE ledger_accounts " +
            "SET balance = balance + ?, lifetime_inflow = lifetime_inflow + ?, " +
            "    tier_points = tier_points + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? RETURNING " + COLUMNS,
            accountRowMapper(),
            delta, inflow, tierPointsDelta, accountId);
    }

    public void updateTier(UUID accountId, String tier) {
        jdbcTemplate.update(
            "UPDATE ledger_accounts SET tier = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            tier, accountId);
    }

    private static Optional<LedgerAccount> single(List<LedgerAccount> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private RowMapper<LedgerAccount> accountRowMapper() {
        return (rs, rowNum) -> new LedgerAccount(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("owner_id")),
            LedgerType.valueOf(rs.getString("ledger_type")),
            rs.getLong("balance"),
            rs.getLong("lifetime_inflow"),
            rs.getLong("tier_points"),
            rs.getString("tier"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            instant(rs, "archived_at")
        );
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
