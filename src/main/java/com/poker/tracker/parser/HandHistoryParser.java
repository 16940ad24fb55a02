package com.poker.tracker.parser;

import com.google.common.collect.ImmutableList;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;

import java.util.List;

/**
 * Grammar for one platform's hand-history export.
 */
public interface HandHistoryParser {

    Platform platform();

    /**
     * Splits a file into hand blocks at header lines.
     */
    default List<String> split(String text) {
        return HandTextSupport.splitBlocks(text, platform().getHeaderPattern());
    }

    /**
     * Parses one hand block.
     *
     * @param heroName player to treat as hero, or null to use the player in the
     *                 {@code Dealt to} line
     * @throws HandParseException if the block cannot be parsed with confidence
     */
    Hand parseHand(String block, String heroName);

    /**
     * Parses every block of a file. A failing block is reported and skipped.
     */
    default ParseResult parse(String text, String heroName) {
        ImmutableList.Builder<Hand> hands = ImmutableList.builder();
        ImmutableList.Builder<ParseFailure> failures = ImmutableList.builder();
        for (String block : split(text)) {
            try {
                hands.add(parseHand(block, heroName));
            } catch (HandParseException e) {
                failures.add(new ParseFailure(e.getHandId(), e.getMessage()));
            }
        }
        return new ParseResult(hands.build(), failures.build());
    }

    /**
     * Hand id from a block's header line, or null.
     */
    default String handIdOf(String block) {
        return HandTextSupport.handIdOf(block, platform().getHeaderPattern());
    }
}
