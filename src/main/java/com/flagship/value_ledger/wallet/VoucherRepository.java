package com.flagship.value_ledger.wallet;

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
 * JDBC access to vouchers and voucher_usages.
 */
@Repository
public class VoucherRepository {

    private static final String COLUMNS =
        "id, code, name, amount, usage_limit, usage_count, status, valid_from, valid_until, created_at";

    private final JdbcTemplate jdbcTemplate;

    public VoucherRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Voucher voucher) {
        jdbcTemplate.update(
            "INSERT INTO vouchers (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            voucher.getId(),
            voucher.getCode(),
            voucher.getName(),
            voucher.getAmount(),
            voucher.getUsageLimit(),
            voucher.getUsageCount(),
            voucher.getStatus().dbValue(),
            Timestamp.from(voucher.getValidFrom()),
            Timestamp.from(voucher.getValidUntil()),
            Timestamp.from(voucher.getCreatedAt())
        );
    }

    public Optional<Voucher> findByCode(String code) {
        List<Voucher> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM vouchers WHERE code = ?", voucherRowMapper(), code);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Row-locks the voucher; concurrent uses of the same code queue here.
     */
    public Optional<Voucher> lockByCode(String code) {
        List<Voucher> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM vouchers WHERE code = ? FOR UPDATE", voucherRowMapper(), code);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void updateUsageCount(Voucher voucher) {
        jdbcTemplate.update(
            "UPDATE vouchers SET usage_count = ? WHERE id = ?", voucher.getUsageCount(), voucher.getId());
    }

    public void updateStatus(UUID voucherId, VoucherStatus status) {
        jdbcTemplate.update("UPDATE vouchers SET status = ? WHERE id = ?", status.dbValue(), voucherId);
    }

    public boolean isUsedBy(UUID voucherId, UUID userId) {
        Boolean used = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM voucher_usages WHERE voucher_id = ? AND user_id = ?)",
            Boolean.class, voucherId, userId);
        return Boolean.TRUE.equals(used);
    }

    public void insertUsage(UUID voucherId, UUID userId, UUID journalEntryId, Instant usedAt) {
        jdbcTemplate.update(
            "INSERT INTO voucher_usages (id, voucher_id, user_id, journal_entry_id, used_at) VALUES (?, ?, ?, ?, ?)",
            UUID.randomUUID(), voucherId, userId, journalEntryId, Timestamp.from(usedAt));
    }

    public long countUsages(UUID voucherId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM voucher_usages WHERE voucher_id = ?", Long.class, voucherId);
        return count != null ? count : 0L;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private RowMapper<Voucher> voucherRowMapper() {
        return (rs, rowNum) -> new Voucher(
            UUID.fromString(rs.getString("id")),
            rs.getString("code"),
            rs.getString("name"),
            rs.getLong("amount"),
            rs.getInt("usage_limit"),
            rs.getInt("usage_count"),
            VoucherStatus.fromDbValue(rs.getString("status")),
            instant(rs, "valid_from"),
            instant(rs, "valid_until"),
            instant(rs, "created_at")
        );
    }
}
