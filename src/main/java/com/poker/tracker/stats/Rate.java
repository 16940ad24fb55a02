package com.poker.tracker.stats;

import lombok.Value;

/**
 * A ratio statistic. The percentage is null when there was no opportunity.
 */
@Value
public class Rate {

    long events;
    long opportunities;
    Double percentage;

    public static Rate of(RateCounter counter) {
        Double percentage = counter.getOpportunities() == 0
                ? null
                : 100.0 * counter.getEvents() / counter.getOpportunities();
        return new Rate(counter.getEvents(), counter.getOpportunities(), percentage);
    }

    public boolean isDefined() {
        return percentage != null;
    }
}
