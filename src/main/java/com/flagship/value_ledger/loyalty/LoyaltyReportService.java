package com.flagship.value_ledger.loyalty;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only program statistics over the points ledger and the reward catalog.
 */
@Service
@RequiredArgsConstructor
public class LoyaltyReportService {

    static final int ACTIVITY_WINDOW_DAYS = 30;

    private final JdbcTemplate jdbcTemplate;
    private final TierEngine tierEngine;
    private final Clock clock;

    @Transactional(readOnly = true)
    public LoyaltyStatistics statistics() {
        Instant since = Instant.now(clock).minus(Duration.ofDays(ACTIVITY_WINDOW_DAYS));

        LoyaltyStatistics.LoyaltyStatisticsBuilder builder = LoyaltyStatistics.builder()
                .activityWindowDays(ACTIVITY_WINDOW_DAYS);

        jdbcTemplate.query(
            "SELECT COUNT(*) AS accounts, COALESCE(SUM(balance), 0) AS outstanding, " +
            "COALESCE(SUM(lifetime_inflow), 0) AS lifetime, COALESCE(ROUND(AVG(balance)), 0) AS average " +
            "FROM ledger_accounts WHERE ledger_type = 'POINTS'",
            rs -> {
                builder.totalAccounts(rs.getLong("accounts"))
                        .pointsOutstanding(rs.getLong("outstanding"))
                        .lifetimePointsEarned(rs.getLong("lifetime"))
                        .averageBalance(rs.getLong("average"));
            });

        Map<String, Long> distribution = new LinkedHashMap<>();
        tierEngine.tiers().forEach(tier -> distribution.put(tier.getCode(), 0L));
        jdbcTemplate.query(
            "SELECT tier, COUNT(*) AS accounts FROM ledger_accounts " +
            "WHERE ledger_type = 'POINTS' AND tier IS NOT NULL GROUP BY tier",
            rs -> {
                distribution.put(rs.getString("tier"), rs.getLong("accounts"));
            });
        builder.tierDistribution(distribution);

        List<LoyaltyStatistics.KindActivity> activity = jdbcTemplate.query(
            "SELECT j.kind, COUNT(*) AS entries, COALESCE(SUM(ABS(j.delta)), 0) AS points " +
            "FROM journal_entries j JOIN ledger_accounts a ON a.id = j.account_id " +
            "WHERE a.ledger_type = 'POINTS' AND j.created_at >= ? " +
            "GROUP BY j.kind ORDER BY j.kind",
            (rs, rowNum) -> new LoyaltyStatistics.KindActivity(
                rs.getString("kind"), rs.getLong("entries"), rs.getLong("points")),
            Timestamp.from(since));
        builder.recentActivity(activity);

        List<LoyaltyStatistics.RewardTypeActivity> rewards = jdbcTemplate.query(
            "SELECT reward_type, COUNT(*) AS rewards, COALESCE(SUM(redeemed_count), 0) AS redemptions, " +
            "COALESCE(SUM(points_required * redeemed_count), 0) AS points_spent " +
            "FROM rewards GROUP BY reward_type ORDER BY reward_type",
            (rs, rowNum) -> new LoyaltyStatistics.RewardTypeActivity(
                rs.getString("reward_type"), rs.getLong("rewards"),
                rs.getLong("redemptions"), rs.getLong("points_spent")));
        builder.rewardActivity(rewards);

        return builder.build();
    }
}
