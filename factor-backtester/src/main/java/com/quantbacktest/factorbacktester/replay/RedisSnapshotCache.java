package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.config.BacktestProperties;
import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Snapshot cache shared between orchestrator instances through Redis.
 * Redis errors degrade to cache misses; the replayer then fetches from the provider.
 */
@Component
@ConditionalOnProperty(prefix = "backtest.replay", name = "cache-type", havingValue = "redis")
@RequiredArgsConstructor
@Slf4j
public class RedisSnapshotCache implements SnapshotCache {

    private final RedisTemplate<String, DataSnapshot> snapshotRedisTemplate;
    private final BacktestProperties properties;

    @Override
    public Optional<DataSnapshot> get(SnapshotKey key) {
        try {
            return Optional.ofNullable(snapshotRedisTemplate.opsForValue().get(redisKey(key)));
        } catch (DataAccessException e) {
            log.warn("Snapshot cache read failed for {}: {}", key.asString(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(SnapshotKey key, DataSnapshot snapshot) {
        try {
            snapshotRedisTemplate.opsForValue().set(redisKey(key), snapshot);
        } catch (DataAccessException e) {
            log.warn("Snapshot cache write failed for {}: {}", key.asString(), e.getMessage());
        }
    }

    @Override
    public void clear() {
        Set<String> keys = snapshotRedisTemplate.keys(properties.getReplay().getRedisKeyPrefix() + ":*");
        if (keys != null && !keys.isEmpty()) {
            snapshotRedisTemplate.delete(keys);
            log.info("Cleared {} cached snapshots", keys.size());
        }
    }

    private String redisKey(SnapshotKey key) {
        return properties.getReplay().getRedisKeyPrefix() + ":" + key.asString();
    }
}
