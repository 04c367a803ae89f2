package com.flagship.value_ledger.rewards;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to rewards and reward_redemptions.
 */
@Repository
public class RewardRepository {

    private static final String COLUMNS =
        "id, merchant_id, name, description, reward_type, value, points_required, quantity, " +
        "redeemed_count, status, valid_until, created_at";

    private static final String AVAILABLE =
        " WHERE status = 'active' AND (valid_until IS NULL OR valid_until > ?)" +
        " AND (quantity IS NULL OR redeemed_count < quantity)";

    private final JdbcTemplate jdbcTemplate;

    public RewardRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Reward reward) {
        jdbcTemplate.update(
            "INSERT INTO rewards (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            reward.getId(),
            reward.getMerchantId(),
            reward.getName(),
            reward.getDescription(),
            reward.getRewardType().dbValue(),
            reward.getValue(),
            reward.getPointsRequired(),
            reward.getQuantity(),
            reward.getRedeemedCount(),
            reward.getStatus().dbValue(),
            timestamp(reward.getValidUntil()),
            timestamp(reward.getCreatedAt())
        );
    }

    public Optional<Reward> findById(UUID rewardId) {
        List<Reward> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM rewards WHERE id = ?", rewardRowMapper(), rewardId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Row-locks the reward; concurrent redemptions of the same reward queue here.
     */
    public Optional<Reward> lockById(UUID rewardId) {
        List<Reward> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM rewards WHERE id = ? FOR UPDATE", rewardRowMapper(), rewardId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void updateState(Reward reward) {
        jdbcTemplate.update(
            "UPDATE rewards SET redeemed_count = ?, status = ? WHERE id = ?",
            reward.getRedeemedCount(), reward.getStatus().dbValue(), reward.getId());
    }

    /**
     * Redeemable rewards (active, unexpired, with quantity left), cheapest first.
     */
    public List<Reward> findAvailable(Instant now, RewardType type, UUID merchantId, int limit, long offset) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM rewards" + AVAILABLE);
        List<Object> params = filterParams(sql, now, type, merchantId);
        sql.append(" ORDER BY points_required ASC, created_at ASC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql.toString(), rewardRowMapper(), params.toArray());
    }

    public long countAvailable(Instant now, RewardType type, UUID merchantId) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM rewards" + AVAILABLE);
        List<Object> params = filterParams(sql, now, type, merchantId);
        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    /**
     * Records a redemption.
     *
     * @return false if its redemption code is already taken; the row is not written
     */
    public boolean insertRedemption(RewardRedemption redemption) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO reward_redemptions (id, reward_id, user_id, account_id, journal_entry_id, " +
            "redemption_code, points_spent, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT ON CONSTRAINT uq_reward_redemptions_code DO NOTHING",
            redemption.getId(),
            redemption.getRewardId(),
            redemption.getUserId(),
            redemption.getAccountId(),
            redemption.getJournalEntryId(),
            redemption.getRedemptionCode(),
            redemption.getPointsSpent(),
            timestamp(redemption.getCreatedAt())
        );
        return inserted == 1;
    }

    public long countRedemptions(UUID rewardId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reward_redemptions WHERE reward_id = ?", Long.class, rewardId);
        return count != null ? count : 0L;
    }

    private static List<Object> filterParams(StringBuilder sql, Instant now, RewardType type, UUID merchantId) {
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(now));
        if (type != null) {
            sql.append(" AND reward_type = ?");
            params.add(type.dbValue());
        }
        if (merchantId != null) {
            sql.append(" AND merchant_id = ?");
            params.add(merchantId);
        }
        return params;
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private RowMapper<Reward> rewardRowMapper() {
        return (rs, rowNum) -> {
            String merchantId = rs.getString("merchant_id");
            long value = rs.getLong("value");
            Long rewardValue = rs.wasNull() ? null : value;
            int quantity = rs.getInt("quantity");
            Integer rewardQuantity = rs.wasNull() ? null : quantity;
            return new Reward(
                UUID.fromString(rs.getString("id")),
                merchantId != null ? UUID.fromString(merchantId) : null,
                rs.getString("name"),
                rs.getString("description"),
                RewardType.fromDbValue(rs.getString("reward_type")),
                rewardValue,
                rs.getLong("points_required"),
                rewardQuantity,
                rs.getInt("redeemed_count"),
                RewardStatus.fromDbValue(rs.getString("status")),
                instant(rs, "valid_until"),
                instant(rs, "created_at")
            );
        };
    }
}
