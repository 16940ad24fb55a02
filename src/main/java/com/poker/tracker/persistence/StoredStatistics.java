package com.poker.tracker.persistence;

import com.poker.tracker.stats.AggregateCounters;
import com.poker.tracker.stats.StatisticsFilter;
import lombok.Value;

/**
 * Cached counters for one user and filter, as read back from a store.
 */
@Value
public class StoredStatistics {

    String user;
    StatisticsFilter filter;
    long generation;
    AggregateCounters counters;
}
