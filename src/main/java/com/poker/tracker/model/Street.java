package com.poker.tracker.model;

import java.util.List;

/**
 * Betting rounds in dealing order.
 */
public enum Street {

    PREFLOP(0),
    FLOP(3),
    TURN(4),
    RIVER(5);

    public static final List<Street> POSTFLOP = List.of(FLOP, TURN, RIVER);

    private final int boardCards;

    Street(int boardCards) {
        this.boardCards = boardCards;
    }

    /**
     * Number of community cards on the board once this street is dealt.
     */
    public int getBoardCards() {
        return boardCards;
    }
}
