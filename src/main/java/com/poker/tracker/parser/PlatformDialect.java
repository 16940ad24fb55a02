package com.poker.tracker.parser;

import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.Platform;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The parts of a hand-history grammar that differ between platforms. Plugged
 * into a {@link HandGrammar}, which handles everything the platforms share.
 */
interface PlatformDialect {

    Platform platform();

    /**
     * Fills the tournament fields and blinds when the game description is a
     * tournament one.
     *
     * @return the timestamp text, or empty when the description is not a tournament
     */
    Optional<String> tournamentHeader(HandAssembler hand, String description);

    /**
     * Forced bet verbs; group 1 is the kind, group 2 the amount, group 3 the all-in suffix.
     */
    Pattern postPattern();

    ActionType postType(String kind);

    /**
     * Handles a platform-only action verb.
     *
     * @return false if the verb is not one of this platform's
     */
    default boolean action(HandAssembler hand, String player, String verb) {
        return false;
    }

    /**
     * Extra chat and status verbs that carry no action.
     */
    default boolean ignorable(String verb) {
        return false;
    }

    /**
     * Fees taken from the pot besides the rake, read from the rest of the total pot line.
     */
    default BigDecimal fees(String potLineTail) {
        return BigDecimal.ZERO;
    }
}
