package com.flagship.value_ledger.rewards;

import com.flagship.value_ledger.ledger.LedgerError;
import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.ledger.LedgerService;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.ledger.ResultPage;
import com.flagship.value_ledger.loyalty.LoyaltyAccountService;
import com.flagship.value_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reward redemption against a real database, including the quantity bound
 * under concurrent redemptions.
 */
class RewardCatalogServiceTest extends PostgresIntegrationTest {

    @Autowired
    private RewardCatalogService catalogService;

    @Autowired
    private RewardRepository rewardRepository;

    @Autowired
    private LoyaltyAccountService loyaltyService;

    @Autowired
    private LedgerService ledgerService;

    private UUID memberWithPoints(long amountSpent) {
        UUID userId = UUID.randomUUID();
        assertTrue(loyaltyService.earn(userId, amountSpent, "seed-" + userId, "payment").isSuccess());
        return userId;
    }

    private Reward reward(UUID merchantId, long pointsRequired, Integer quantity, Instant validUntil) {
        return catalogService.createReward(NewReward.builder()
                .merchantId(merchantId)
                .name("Free coffee")
                .description("One regular coffee")
                .rewardType(RewardType.VOUCHER)
                .value(4_500L)
                .pointsRequired(pointsRequired)
                .quantity(quantity)
                .validUntil(validUntil)
                .build());
    }

    private long pointsOf(UUID userId) {
        return ledgerService.findAccount(userId, LedgerType.POINTS).orElseThrow().getBalance();
    }

    @Test
    @DisplayName("Redeeming a reward debits points and returns a code")
    void testRedeemReward() {
        printTestHeader("Redeem Reward");

        UUID userId = memberWithPoints(50_000);
        Reward reward = reward(null, 300, 10, null);

        LedgerResult<RedemptionResult> result = catalogService.redeemReward(userId, reward.getId());
        printOutput("Result", result);

        assertTrue(result.isSuccess());
        RedemptionResult redemption = result.getValue();
        assertTrue(redemption.getRedemptionCode().matches("RWD-[0-9A-Z]+-[0-9A-Z]{4}"));
        assertEquals(300, redemption.getPointsSpent());
        assertEquals(200, redemption.getNewPointsBalance());
        assertTrue(redemption.getInstructions().contains(redemption.getRedemptionCode()));
        assertEquals(200, pointsOf(userId));

        Reward stored = rewardRepository.findById(reward.getId()).orElseThrow();
        assertEquals(1, stored.getRedeemedCount());
        assertEquals(RewardStatus.ACTIVE, stored.getStatus());
        assertEquals(1, rewardRepository.countRedemptions(reward.getId()));
        printSuccess("Reward redeemed");
    }

    @Test
    @DisplayName("The same member may redeem a reward more than once")
    void testRepeatRedemption() {
        UUID userId = memberWithPoints(50_000);
        Reward reward = reward(null, 100, null, null);

        assertTrue(catalogService.redeemReward(userId, reward.getId()).isSuccess());
        assertTrue(catalogService.redeemReward(userId, reward.getId()).isSuccess());

        assertEquals(300, pointsOf(userId));
        assertEquals(2, rewardRepository.countRedemptions(reward.getId()));
    }

    @Test
    @DisplayName("Insufficient points leave the reward and the balance untouched")
    void testInsufficientPoints() {
        printTestHeader("Insufficient Points");

        UUID userId = memberWithPoints(10_000);
        Reward reward = reward(null, 250, 1, null);

        LedgerResult<RedemptionResult> result = catalogService.redeemReward(userId, reward.getId());
        printOutput("Result", result);

        assertEquals(LedgerError.INSUFFICIENT_POINTS, result.getError());
        assertTrue(result.getMessage().contains("150"));
        assertEquals(100, pointsOf(userId));
        assertEquals(0, rewardRepository.findById(reward.getId()).orElseThrow().getRedeemedCount());
    }

    @Test
    @DisplayName("Expired, deactivated and unknown rewards cannot be redeemed")
    void testUnredeemableRewards() {
        printTestHeader("Unredeemable Rewards");

        UUID userId = memberWithPoints(50_000);
        Reward expired = reward(null, 100, null, Instant.now().minus(Duration.ofDays(1)));
        Reward deactivated = reward(null, 100, null, null);
        assertTrue(catalogService.deactivate(deactivated.getId()).isSuccess());

        assertEquals(LedgerError.REWARD_EXPIRED, catalogService.redeemReward(userId, expired.getId()).getError());
        assertEquals(LedgerError.REWARD_UNAVAILABLE,
                catalogService.redeemReward(userId, deactivated.getId()).getError());
        assertEquals(LedgerError.NOT_FOUND, catalogService.redeemReward(userId, UUID.randomUUID()).getError());
        assertEquals(500, pointsOf(userId));

        assertEquals(LedgerError.REWARD_UNAVAILABLE, catalogService.deactivate(deactivated.getId()).getError());
        printSuccess("No points spent");
    }

    @Test
    @DisplayName("The last unit goes to exactly one of two concurrent members")
    void testLastUnitRace() throws Exception {
        printTestHeader("Last Unit Race");

        Reward reward = reward(null, 100, 1, null);
        List<LedgerResult<RedemptionResult>> results =
                redeemConcurrently(reward.getId(), List.of(memberWithPoints(10_000), memberWithPoints(10_000)));

        long succeeded = results.stream().filter(LedgerResult::isSuccess).count();
        long exhausted = results.stream().filter(r -> r.getError() == LedgerError.REWARD_EXHAUSTED).count();
        printOutput("Succeeded", succeeded);
        printOutput("Exhausted", exhausted);

        assertEquals(1, succeeded);
        assertEquals(1, exhausted);
        Reward stored = rewardRepository.findById(reward.getId()).orElseThrow();
        assertEquals(RewardStatus.EXHAUSTED, stored.getStatus());
        assertEquals(1, stored.getRedeemedCount());
        printSuccess("Exactly one winner");
    }

    @Test
    @DisplayName("Concurrent redemptions never exceed the reward quantity")
    void testQuantityBound() throws Exception {
        printTestHeader("Quantity Bound");

        Reward reward = reward(null, 100, 3, null);
        List<UUID> members = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            members.add(memberWithPoints(10_000));
        }

        List<LedgerResult<RedemptionResult>> results = redeemConcurrently(reward.getId(), members);

        long succeeded = results.stream().filter(LedgerResult::isSuccess).count();
        long exhausted = results.stream().filter(r -> r.getError() == LedgerError.REWARD_EXHAUSTED).count();
        printOutput("Succeeded", succeeded);

        assertEquals(3, succeeded);
        assertEquals(7, exhausted);
        assertEquals(3, rewardRepository.countRedemptions(reward.getId()));
        long debited = members.stream().filter(member -> pointsOf(member) == 0).count();
        assertEquals(3, debited, "Only winners pay");
        printSuccess("Quantity respected");
    }

    @Test
    @DisplayName("Available rewards are listed cheapest first with the member's affordability")
    void testListAvailable() {
        printTestHeader("List Available");

        UUID merchantId = UUID.randomUUID();
        UUID userId = memberWithPoints(20_000);
        reward(merchantId, 500, null, null);
        reward(merchantId, 150, 5, null);
        reward(merchantId, 100, null, Instant.now().minus(Duration.ofHours(1)));

        ResultPage<RewardView> page = catalogService.listAvailable(userId, null, merchantId, 1, 10);
        printOutput("Listed", page.getItems().size());

        assertEquals(2, page.getTotal());
        assertEquals(150, page.getItems().get(0).getPointsRequired());
        assertTrue(page.getItems().get(0).isCanRedeem());
        assertFalse(page.getItems().get(1).isCanRedeem());
        assertEquals(300, page.getItems().get(1).getPointsNeeded());
        assertEquals(0, catalogService.listAvailable(userId, RewardType.PRODUCT, merchantId, 1, 10).getTotal());

        ResultPage<RewardView> beyond = catalogService.listAvailable(userId, null, merchantId, Integer.MAX_VALUE, 50);
        assertTrue(beyond.getItems().isEmpty());
        assertEquals(2, beyond.getTotal());
    }

    private List<LedgerResult<RedemptionResult>> redeemConcurrently(UUID rewardId, List<UUID> members)
            throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(members.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LedgerResult<RedemptionResult>>> futures = new ArrayList<>();
        for (UUID member : members) {
            futures.add(pool.submit(() -> {
                start.await();
                return catalogService.redeemReward(member, rewardId);
            }));
        }
        start.countDown();

        List<LedgerResult<RedemptionResult>> results = new ArrayList<>();
        for (Future<LedgerResult<RedemptionResult>> future : futures) {
            results.add(future.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();
        return results;
    }
}
