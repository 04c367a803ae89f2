package com.flagship.value_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to journal_entries. Insert and read only: the table rejects
 * UPDATE and DELETE through a trigger.
 */
@Repository
public class JournalRepository {

    private static final String COLUMNS =
        "id, account_id, delta, kind, source, reference_id, description, expires_at, created_at, sequence_number";

    private final JdbcTemplate jdbcTemplate;

    public JournalRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry.
     *
     * @return false if an entry with the same (account, kind, referenceId) already exists
     */
    public boolean insert(JournalEntry entry) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO journal_entries (id, account_id, delta, kind, source, reference_id, description, expires_at, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT ON CONSTRAINT uq_journal_reference DO NOTHING",
            entry.getId(),
            entry.getAccountId(),
            entry.getDelta(),
            entry.getKind().dbValue(),
            entry.getSource(),
            entry.getReferenceId(),
            entry.getDescription(),
            timestamp(entry.getExpiresAt()),
            timestamp(entry.getCreatedAt())
        );
        return inserted == 1;
    }

    public boolean existsByReference(UUID accountId, EntryKind kind, String referenceId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM journal_entries WHERE account_id = ? AND kind = ? AND reference_id = ?)",
            Boolean.class,
            accountId, kind.dbValue(), referenceId);
        return Boolean.TRUE.equals(exists);
    }

    public Optional<JournalEntry> findByReference(UUID accountId, EntryKind kind, String referenceId) {
        List<JournalEntry> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM journal_entries WHERE account_id = ? AND kind = ? AND reference_id = ?",
            journalRowMapper(),
            accountId, kind.dbValue(), referenceId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<JournalEntry> findByAccount(UUID accountId, EntryKind kind, int limit, long offset) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM journal_entries WHERE account_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(accountId);
        if (kind != null) {
            sql.append(" AND kind = ?");
            params.add(kind.dbValue());
        }
        sql.append(" ORDER BY sequence_number DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql.toString(), journalRowMapper(), params.toArray());
    }

    public long countByAccount(UUID accountId, EntryKind kind) {
        Long count = kind == null
            ? jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM journal_entries WHERE account_id = ?", Long.class, accountId)
            : jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM journal_entries WHERE account_id = ? AND kind = ?", Long.class,
                accountId, kind.dbValue());
        return count != null ? count : 0L;
    }

    public long sumDeltas(UUID accountId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM journal_entries WHERE account_id = ?",
            Long.class, accountId);
        return sum != null ? sum : 0L;
    }

    /**
     * Sum of the deltas of one kind and source journaled since the given instant.
     */
    public long sumDeltasSince(UUID accountId, EntryKind kind, String source, Instant since) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM journal_entries " +
            "WHERE account_id = ? AND kind = ? AND source = ? AND created_at >= ?",
            Long.class, accountId, kind.dbValue(), source, Timestamp.from(since));
        return sum != null ? sum : 0L;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private RowMapper<JournalEntry> journalRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getLong("delta"),
            EntryKind.fromDbValue(rs.getString("kind")),
            rs.getString("source"),
            rs.getString("reference_id"),
            rs.getString("description"),
            LedgerAccountRepository.instant(rs, "expires_at"),
            LedgerAccountRepository.instant(rs, "created_at"),
            rs.getLong("sequence_number")
        );
    }
}
