package com.flagship.value_ledger.rewards;

import com.flagship.value_ledger.ledger.LedgerResult;
import com.flagship.value_ledger.loyalty.LoyaltyAccountService;
import com.flagship.value_ledger.support.PostgresIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Redemption when the generated code is already taken.
 */
class RedemptionCodeCollisionTest extends PostgresIntegrationTest {

    @MockBean
    private RedemptionCodeGenerator codeGenerator;

    @Autowired
    private RewardCatalogService catalogService;

    @Autowired
    private RewardRepository rewardRepository;

    @Autowired
    private LoyaltyAccountService loyaltyService;

    private UUID memberWithPoints() {
        UUID userId = UUID.randomUUID();
        assertTrue(loyaltyService.earn(userId, 50_000, "seed-" + userId, "payment").isSuccess());
        return userId;
    }

    private Reward reward() {
        return catalogService.createReward(NewReward.builder()
                .name("Free coffee")
                .rewardType(RewardType.VOUCHER)
                .pointsRequired(100)
                .quantity(10)
                .build());
    }

    @Test
    @DisplayName("A colliding code is replaced and the redemption succeeds")
    void testCollidingCodeIsRedrawn() {
        printTestHeader("Colliding Redemption Code");

        // Given: the first redemption takes code A
        String taken = "RWD-T" + Long.toString(System.nanoTime(), 36).toUpperCase() + "-AAAA";
        String fresh = "RWD-T" + Long.toString(System.nanoTime(), 36).toUpperCase() + "-BBBB";
        when(codeGenerator.next()).thenReturn(taken, taken, fresh);
        Reward reward = reward();
        assertTrue(catalogService.redeemReward(memberWithPoints(), reward.getId()).isSuccess());

        // When: the next redemption draws code A again
        UUID second = memberWithPoints();
        LedgerResult<RedemptionResult> result = catalogService.redeemReward(second, reward.getId());
        printOutput("Result", result);

        // Then: it is stored under a new code
        assertTrue(result.isSuccess());
        assertEquals(fresh, result.getValue().getRedemptionCode());
        assertEquals(400, result.getValue().getNewPointsBalance());
        assertEquals(2, rewardRepository.countRedemptions(reward.getId()));
        assertEquals(2, rewardRepository.findById(reward.getId()).orElseThrow().getRedeemedCount());
        verify(codeGenerator, times(3)).next();
        printSuccess("Collision resolved without a storage fault");
    }

    @Test
    @DisplayName("A redemption gives up after repeated collisions and changes nothing")
    void testPersistentCollision() {
        String taken = "RWD-T" + Long.toString(System.nanoTime(), 36).toUpperCase() + "-CCCC";
        when(codeGenerator.next()).thenReturn(taken);
        Reward reward = reward();
        assertTrue(catalogService.redeemReward(memberWithPoints(), reward.getId()).isSuccess());

        UUID second = memberWithPoints();
        assertThrows(IllegalStateException.class, () -> catalogService.redeemReward(second, reward.getId()));

        assertEquals(1, rewardRepository.countRedemptions(reward.getId()));
        assertEquals(1, rewardRepository.findById(reward.getId()).orElseThrow().getRedeemedCount());
        assertEquals(500, loyaltyService.getBalance(second).getPointsBalance());
    }
}
