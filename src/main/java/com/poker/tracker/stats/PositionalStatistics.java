package com.poker.tracker.stats;

import com.google.common.collect.ImmutableMap;
import com.poker.tracker.model.Position;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PositionalStatistics {

    Position position;
    long hands;
    ImmutableMap<StatKey, Rate> rates;
    Double aggressionFactor;
    Double winRateBb100;
    BigDecimal netWinnings;

    public Rate rate(StatKey key) {
        return rates.get(key);
    }
}
