package com.poker.tracker.model;

import java.util.regex.Pattern;

/**
 * Supported hand-history grammars. Each platform is recognised by the header
 * line that opens every hand block of its export format.
 */
public enum Platform {

    POKERSTARS("PokerStars",
            Pattern.compile("^PokerStars (?:Zoom )?(?:Hand|Game) #(\\d+):")),

    GGPOKER("GGPoker",
            Pattern.compile("^(?:GGPoker|GG Poker|GGNetwork|Poker) Hand #([A-Za-z]{0,4}\\d+):"));

    private final String displayName;
    private final Pattern headerPattern;

    Platform(String displayName, Pattern headerPattern) {
        this.displayName = displayName;
        this.headerPattern = headerPattern;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Pattern anchored at the start of a line; group 1 is the hand id.
     */
    public Pattern getHeaderPattern() {
        return headerPattern;
    }
}
