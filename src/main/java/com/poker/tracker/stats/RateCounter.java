package com.poker.tracker.stats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateCounter {

    private long events;
    private long opportunities;

    /**
     * Counts an opportunity, and the event if it happened.
     */
    public void record(boolean event) {
        opportunities++;
        if (event) {
            events++;
        }
    }

    public void add(RateCounter other) {
        events += other.events;
        opportunities += other.opportunities;
    }

    public RateCounter copy() {
        return new RateCounter(events, opportunities);
    }
}
