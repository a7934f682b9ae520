package com.quantbacktest.factorbacktester.replay;

import com.quantbacktest.factorbacktester.domain.DataSnapshot;

import java.util.Optional;

/**
 * Memoization store for validated snapshots. Entries never go stale: a key always maps to the same historical data.
 */
public interface SnapshotCache {

    Optional<DataSnapshot> get(SnapshotKey key);

    void put(SnapshotKey key, DataSnapshot snapshot);

    void clear();
}
