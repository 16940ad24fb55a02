package com.poker.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One entry of a hand's action sequence.
 */
@Value
@Builder(toBuilder = true)
public class Action {

    /**
     * Position of the action in the hand, starting at 1 and strictly increasing.
     */
    int sequence;

    String player;
    Street street;
    ActionType type;

    /**
     * Chips moved into the pot by this action. For a raise this is the increment
     * over what the player had already committed on the street. Null for
     * folds and checks.
     */
    BigDecimal amount;

    /**
     * Street total after a raise, as printed by the client. Null for other types.
     */
    BigDecimal raiseTo;

    BigDecimal stackAfter;
    boolean allIn;

    // seconds of time bank consumed before acting, when the client reports it
    Integer timeUsed;
}
