package com.poker.tracker.stats;

import com.poker.tracker.HandHistoryException;

/**
 * Invalid filter or inconsistent counters handed to the aggregator.
 */
public class AggregationException extends HandHistoryException {

    public AggregationException(String message) {
        super(message);
    }
}
