package com.poker.tracker.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Table position of a player relative to the button.
 */
public enum Position {

    BTN("BTN"),
    SB("SB"),
    BB("BB"),
    UTG("UTG"),
    UTG1("UTG+1"),
    UTG2("UTG+2"),
    MP("MP"),
    MP1("MP+1"),
    HJ("HJ"),
    CO("CO");

    public static final Set<Position> STEAL_POSITIONS = EnumSet.of(CO, BTN, SB);
    public static final Set<Position> BLINDS = EnumSet.of(SB, BB);

    private final String label;

    Position(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
