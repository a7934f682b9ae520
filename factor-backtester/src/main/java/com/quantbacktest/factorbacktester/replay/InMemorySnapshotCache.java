package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.domain.DataSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local snapshot cache, retained until {@link #clear()}.
 */
@Component
@ConditionalOnProperty(prefix = "backtest.replay", name = "cache-type", havingValue = "memory", matchIfMissing = true)
public class InMemorySnapshotCache implements SnapshotCache {

    private final Map<SnapshotKey, DataSnapshot> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<DataSnapshot> get(SnapshotKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(SnapshotKey key, DataSnapshot snapshot) {
        entries.put(key, snapshot);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
