package com.poker.tracker.model;

public enum SeatOutcome {
    WON,
    LOST,
    FOLDED
}
