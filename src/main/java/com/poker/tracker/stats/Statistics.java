package com.poker.tracker.stats;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.poker.tracker.model.Position;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable statistics snapshot for one user and filter. Each incremental
 * update produces a new snapshot with the next generation number.
 */
@Value
@Builder
public class Statistics {

    String user;
    StatisticsFilter filter;
    String filterFingerprint;
    long generation;

    long hands;
    ImmutableMap<StatKey, Rate> rates;
    Double aggressionFactor;
    Double winRateBb100;
    BigDecimal netWinnings;
    BigDecimal redLineWinnings;
    BigDecimal blueLineWinnings;

    ImmutableMap<Position, PositionalStatistics> positional;
    ImmutableList<TrendBucket> trends;

    @Getter(AccessLevel.NONE)
    AggregateCounters counters;

    public Rate rate(StatKey key) {
        return rates.get(key);
    }

    /**
     * Copy of the counters this snapshot was derived from.
     */
    @JsonIgnore
    public AggregateCounters getCounters() {
        return counters.copy();
    }
}
