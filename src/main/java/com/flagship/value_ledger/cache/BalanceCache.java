package com.flagship.value_ledger.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.value_ledger.ledger.LedgerType;
import com.flagship.value_ledger.ledger.TransactionHooks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Cache-aside store for balance read views, keyed by owner and ledger type.
 *
 * Only display reads go through here. Mutations always read the locked account
 * row and evict the owner's entry once they have committed; a stale entry lives
 * at most {@code ledger.balance-cache.ttl-seconds}. Redis being unreachable
 * degrades to a cache miss.
 */
@Component
@Slf4j
public class BalanceCache {

    private static final String KEY_PREFIX = "ledger:balance:";

    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Duration ttl;

    public BalanceCache(ObjectProvider<StringRedisTemplate> redisTemplate,
                        ObjectMapper objectMapper,
                        @Value("${ledger.balance-cache.enabled:true}") boolean enabled,
                        @Value("${ledger.balance-cache.ttl-seconds:30}") long ttlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public <T> Optional<T> get(LedgerType ledgerType, UUID ownerId, Class<T> viewType) {
        StringRedisTemplate redis = redis();
        if (redis == null) {
            return Optional.empty();
        }
        String key = key(ledgerType, ownerId);
        try {
            String json = redis.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, viewType));
        } catch (DataAccessException e) {
            log.warn("Balance cache read failed, falling back to database: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable balance cache entry: key={}, error={}", key, e.getMessage());
            evict(ledgerType, ownerId);
            return Optional.empty();
        }
    }

    public void put(LedgerType ledgerType, UUID ownerId, Object view) {
        StringRedisTemplate redis = redis();
        if (redis == null) {
            return;
        }
        String key = key(ledgerType, ownerId);
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(view), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Balance cache write failed: key={}, error={}", key, e.getMessage());
        }
    }

    /**
     * Evicts the owner's entry after the current transaction commits
     * (immediately when there is none).
     */
    public void evictAfterCommit(LedgerType ledgerType, UUID ownerId) {
        if (!enabled) {
            return;
        }
        TransactionHooks.afterCommit(() -> evict(ledgerType, ownerId));
    }

    void evict(LedgerType ledgerType, UUID ownerId) {
        StringRedisTemplate redis = redis();
        if (redis == null) {
            return;
        }
        String key = key(ledgerType, ownerId);
        try {
            redis.delete(key);
        } catch (DataAccessException e) {
            log.warn("Balance cache eviction failed: key={}, error={}", key, e.getMessage());
        }
    }

    private StringRedisTemplate redis() {
        return enabled ? redisTemplate.getIfAvailable() : null;
    }

    static String key(LedgerType ledgerType, UUID ownerId) {
        return KEY_PREFIX + ledgerType.name().toLowerCase() + ":" + ownerId;
    }
}
