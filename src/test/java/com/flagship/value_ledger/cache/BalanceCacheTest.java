package com.flagship.value_ledger.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.wallet.WalletBalance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BalanceCacheTest {

    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;
    private ObjectProvider<StringRedisTemplate> provider;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final UUID ownerId = UUID.randomUUID();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        values = mock(ValueOperations.class);
        provider = mock(ObjectProvider.class);
        when(redis.opsForValue()).thenReturn(values);
        when(provider.getIfAvailable()).thenReturn(redis);
    }

    private BalanceCache cache(boolean enabled) {
        return new BalanceCache(provider, objectMapper, enabled, 30);
    }

    @Test
    @DisplayName("Entries are keyed by ledger type and owner and expire after the TTL")
    void testPutAndGet() throws Exception {
        WalletBalance balance = WalletBalance.builder().balance(1_500).lifetimeInflow(2_000).build();
        String key = "ledger:balance:currency:" + ownerId;

        cache(true).put(LedgerType.CURRENCY, ownerId, balance);
        verify(values).set(eq(key), anyString(), eq(Duration.ofSeconds(30)));

        when(values.get(key)).thenReturn(objectMapper.writeValueAsString(balance));
        Optional<WalletBalance> cached = cache(true).get(LedgerType.CURRENCY, ownerId, WalletBalance.class);
        assertEquals(Optional.of(balance), cached);
    }

    @Test
    @DisplayName("Redis failures degrade to a miss")
    void testRedisDownIsMiss() {
        when(values.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertTrue(cache(true).get(LedgerType.POINTS, ownerId, WalletBalance.class).isEmpty());
    }

    @Test
    @DisplayName("Unreadable entries are dropped")
    void testCorruptEntryEvicted() {
        when(values.get(anyString())).thenReturn("{not json");

        assertTrue(cache(true).get(LedgerType.CURRENCY, ownerId, WalletBalance.class).isEmpty());
        verify(redis).delete("ledger:balance:currency:" + ownerId);
    }

    @Test
    @DisplayName("Without a transaction eviction happens immediately")
    void testEvictWithoutTransaction() {
        cache(true).evictAfterCommit(LedgerType.POINTS, ownerId);

        verify(redis).delete("ledger:balance:points:" + ownerId);
    }

    @Test
    @DisplayName("A disabled cache never touches Redis")
    void testDisabled() {
        BalanceCache disabled = cache(false);

        disabled.put(LedgerType.CURRENCY, ownerId, WalletBalance.builder().balance(1).build());
        assertTrue(disabled.get(LedgerType.CURRENCY, ownerId, WalletBalance.class).isEmpty());
        disabled.evictAfterCommit(LedgerType.CURRENCY, ownerId);

        verifyNoInteractions(redis);
    }
}
