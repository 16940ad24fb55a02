package com.poker.tracker.model;

public enum ActionType {

    POST_ANTE,
    POST_SMALL_BLIND,
    POST_BIG_BLIND,
    POST_DEAD_BLIND,
    FOLD,
    CHECK,
    CALL,
    BET,
    RAISE;

    public boolean isForced() {
        return this == POST_ANTE || this == POST_SMALL_BLIND
                || this == POST_BIG_BLIND || this == POST_DEAD_BLIND;
    }

    public boolean isVoluntary() {
        return !isForced();
    }

    public boolean isAggressive() {
        return this == BET || this == RAISE;
    }

    /**
     * Blind postings, excluding antes.
     */
    public boolean isBlind() {
        return this == POST_SMALL_BLIND || this == POST_BIG_BLIND || this == POST_DEAD_BLIND;
    }

    public boolean carriesAmount() {
        return this != FOLD && this != CHECK;
    }
}
