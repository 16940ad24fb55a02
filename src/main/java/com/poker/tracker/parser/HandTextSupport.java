package com.poker.tracker.parser;

import com.google.common.base.Splitter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the grammar parsers.
 */
public final class HandTextSupport {

    public static final String AMOUNT = "[$€£]?([\\d,]+(?:\\.\\d+)?)";

    public static final Pattern CARD = Pattern.compile("[2-9TJQKA][shdc]");

    private static final Splitter LINES = Splitter.onPattern("\\r?\\n");
    private static final Splitter CARDS = Splitter.on(' ').trimResults().omitEmptyStrings();

    private HandTextSupport() {
    }

    public static String stripBom(String text) {
        if (text != null && !text.isEmpty() && text.charAt(0) == '\uFEFF') {
            return text.substring(1);
        }
        return text;
    }

    public static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : LINES.split(stripBom(text))) {
            lines.add(line.strip());
        }
        return lines;
    }

    /**
     * Splits a file into hand blocks, starting a new block at every line the
     * header pattern matches. Text before the first header is discarded.
     */
    public static List<String> splitBlocks(String text, Pattern header) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = null;
        for (String line : lines(text)) {
            if (header.matcher(line).lookingAt()) {
                if (current != null) {
                    blocks.add(current.toString().strip());
                }
                current = new StringBuilder();
            }
            if (current != null) {
                current.append(line).append('\n');
            }
        }
        if (current != null) {
            blocks.add(current.toString().strip());
        }
        return blocks;
    }

    public static int countHeaders(String text, Pattern header) {
        int count = 0;
        for (String line : lines(text)) {
            if (header.matcher(line).lookingAt()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Hand id from a block's header line, or null.
     */
    public static String handIdOf(String block, Pattern header) {
        Matcher matcher = header.matcher(stripBom(block).strip());
        return matcher.lookingAt() ? matcher.group(1) : null;
    }

    public static BigDecimal amount(String raw) {
        return new BigDecimal(raw.replace(",", "").replaceAll("[$€£]", ""));
    }

    /**
     * Parses a space separated card list, e.g. {@code "Ah Kd 7c"}.
     *
     * @throws IllegalArgumentException on a malformed card
     */
    public static List<String> cards(String raw) {
        List<String> cards = new ArrayList<>();
        for (String card : CARDS.split(raw)) {
            if (!CARD.matcher(card).matches()) {
                throw new IllegalArgumentException("Malformed card '" + card + "'");
            }
            cards.add(card);
        }
        return cards;
    }

    public static String currencyOf(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return null;
        }
        return switch (symbol) {
            case "$" -> "USD";
            case "€" -> "EUR";
            case "£" -> "GBP";
            default -> null;
        };
    }
}
