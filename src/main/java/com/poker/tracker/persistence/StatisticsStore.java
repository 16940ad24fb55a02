package com.poker.tracker.persistence;

import com.poker.tracker.stats.AggregateCounters;
import com.poker.tracker.stats.StatisticsFilter;

import java.util.Optional;

/**
 * Cache of statistics counters keyed by user and filter fingerprint.
 */
public interface StatisticsStore {

    /**
     * @return empty on a miss or when the stored entry cannot be read
     */
    Optional<StoredStatistics> read(String user, String filterFingerprint);

    /**
     * Stores the counters unconditionally, replacing any previous entry.
     */
    void write(String user, StatisticsFilter filter, long generation, AggregateCounters counters);

    /**
     * Replaces the counters only if the stored entry is still at
     * {@code expectedGeneration}.
     *
     * @return false if the entry is missing or another writer moved it on
     */
    boolean compareAndWrite(String user, StatisticsFilter filter, long expectedGeneration,
                            long generation, AggregateCounters counters);

    void evict(String user);
}
