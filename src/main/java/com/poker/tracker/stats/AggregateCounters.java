package com.poker.tracker.stats;

import com.poker.tracker.model.Position;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters for a whole filter scope, broken down by hero position and by day.
 * Folded by the aggregator and persisted between incremental updates.
 */
@Data
public class AggregateCounters {

    private StatisticsCounters overall = new StatisticsCounters();
    private Map<Position, StatisticsCounters> byPosition = new EnumMap<>(Position.class);

    // ISO date -> counters
    private Map<String, StatisticsCounters> byDay = new TreeMap<>();

    public AggregateCounters add(AggregateCounters other) {
        overall.add(other.overall);
        other.byPosition.forEach((position, counters) ->
                byPosition.computeIfAbsent(position, p -> new StatisticsCounters()).add(counters));
        other.byDay.forEach((day, counters) ->
                byDay.computeIfAbsent(day, d -> new StatisticsCounters()).add(counters));
        return this;
    }

    public AggregateCounters copy() {
        return new AggregateCounters().add(this);
    }

    public static AggregateCounters merge(AggregateCounters a, AggregateCounters b) {
        return a.copy().add(b);
    }

    public void validate() {
        if (overall == null || byPosition == null || byDay == null) {
            throw new AggregationException("Incomplete counters");
        }
        overall.validate("overall");
        byPosition.forEach((position, counters) -> {
            if (position == null || counters == null) {
                throw new AggregationException("Incomplete positional counters");
            }
            counters.validate(position.getLabel());
        });
        byDay.forEach((day, counters) -> {
            if (day == null || counters == null) {
                throw new AggregationException("Incomplete daily counters");
            }
            counters.validate(day);
        });
    }
}
