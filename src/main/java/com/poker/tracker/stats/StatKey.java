package com.poker.tracker.stats;

import com.poker.tracker.model.Street;

/**
 * Ratio statistics tracked as event / opportunity counters.
 */
public enum StatKey {

    VPIP("VPIP"),
    PFR("PFR"),
    THREE_BET("3-Bet"),
    FOLD_TO_THREE_BET("Fold to 3-Bet"),
    FOUR_BET("4-Bet"),
    FOLD_TO_FOUR_BET("Fold to 4-Bet"),
    COLD_CALL("Cold Call"),
    STEAL("Steal"),
    FOLD_TO_STEAL("Fold to Steal"),
    CBET_FLOP("Flop C-Bet"),
    CBET_TURN("Turn C-Bet"),
    CBET_RIVER("River C-Bet"),
    FOLD_TO_CBET_FLOP("Fold to Flop C-Bet"),
    FOLD_TO_CBET_TURN("Fold to Turn C-Bet"),
    FOLD_TO_CBET_RIVER("Fold to River C-Bet"),
    CHECK_RAISE_FLOP("Flop Check-Raise"),
    CHECK_RAISE_TURN("Turn Check-Raise"),
    CHECK_RAISE_RIVER("River Check-Raise"),
    WTSD("WTSD"),
    WSD("W$SD");

    private final String label;

    StatKey(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static StatKey cbet(Street street) {
        return switch (street) {
            case FLOP -> CBET_FLOP;
            case TURN -> CBET_TURN;
            case RIVER -> CBET_RIVER;
            default -> throw new IllegalArgumentException("No c-bet on " + street);
        };
    }

    public static StatKey foldToCbet(Street street) {
        return switch (street) {
            case FLOP -> FOLD_TO_CBET_FLOP;
            case TURN -> FOLD_TO_CBET_TURN;
            case RIVER -> FOLD_TO_CBET_RIVER;
            default -> throw new IllegalArgumentException("No c-bet on " + street);
        };
    }

    public static StatKey checkRaise(Street street) {
        return switch (street) {
            case FLOP -> CHECK_RAISE_FLOP;
            case TURN -> CHECK_RAISE_TURN;
            case RIVER -> CHECK_RAISE_RIVER;
            default -> throw new IllegalArgumentException("No check-raise on " + street);
        };
    }
}
