package com.poker.tracker.stats;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Statistics for the hands played on one day.
 */
@Value
@Builder
public class TrendBucket {

    LocalDate day;
    long hands;
    Rate vpip;
    Rate pfr;
    Double aggressionFactor;
    Double winRateBb100;
    BigDecimal netWinnings;
}
