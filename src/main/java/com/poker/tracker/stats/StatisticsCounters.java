package com.poker.tracker.stats;

import lombok.Data;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Additive numerators and denominators for one group of hands.
 */
@Data
public class StatisticsCounters {

    private long hands;
    private Map<StatKey, RateCounter> rates = new EnumMap<>(StatKey.class);
    private long aggressiveActions;
    private long calls;
    private BigDecimal netWinnings = BigDecimal.ZERO;
    private BigDecimal netBigBlinds = BigDecimal.ZERO;
    private BigDecimal redLine = BigDecimal.ZERO;
    private BigDecimal blueLine = BigDecimal.ZERO;

    /**
     * Counter for the key, created empty on first use.
     */
    public RateCounter rate(StatKey key) {
        return rates.computeIfAbsent(key, k -> new RateCounter());
    }

    public RateCounter getOrEmpty(StatKey key) {
        RateCounter counter = rates.get(key);
        return counter != null ? counter : new RateCounter();
    }

    public StatisticsCounters add(StatisticsCounters other) {
        hands += other.hands;
        other.rates.forEach((key, counter) -> rate(key).add(counter));
        aggressiveActions += other.aggressiveActions;
        calls += other.calls;
        netWinnings = netWinnings.add(other.netWinnings);
        netBigBlinds = netBigBlinds.add(other.netBigBlinds);
        redLine = redLine.add(other.redLine);
        blueLine = blueLine.add(other.blueLine);
        return this;
    }

    public StatisticsCounters copy() {
        return new StatisticsCounters().add(this);
    }

    /**
     * @throws AggregationException if any counter is negative or a rate has
     *                              more events than opportunities
     */
    public void validate(String scope) {
        if (hands < 0 || aggressiveActions < 0 || calls < 0) {
            throw new AggregationException("Negative counter in " + scope);
        }
        if (rates == null || netWinnings == null || netBigBlinds == null || redLine == null || blueLine == null) {
            throw new AggregationException("Incomplete counters in " + scope);
        }
        rates.forEach((key, counter) -> {
            if (key == null || counter == null) {
                throw new AggregationException("Unknown rate counter in " + scope);
            }
            if (counter.getEvents() < 0 || counter.getOpportunities() < 0) {
                throw new AggregationException("Negative " + key + " counter in " + scope);
            }
            if (counter.getEvents() > counter.getOpportunities()) {
                throw new AggregationException(key + " has more events than opportunities in " + scope);
            }
        });
    }
}
