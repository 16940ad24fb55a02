package com.poker.tracker.parser;

import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.poker.tracker.parser.HandTextSupport.AMOUNT;
import static com.poker.tracker.parser.HandTextSupport.amount;

/**
 * Grammar for PokerStars hand histories (cash, Zoom, tournaments, play money).
 */
@Component
public class PokerStarsParser implements HandHistoryParser, PlatformDialect {

    private static final Pattern TOURNAMENT = Pattern.compile(
            "^Tournament #(\\d+), (.+?) - (?:Match Round \\S+, )?Level ([IVXLCDM\\d]+) \\(([\\d,.]+)/([\\d,.]+)\\) - (.+)$");
    private static final Pattern BUY_IN = Pattern.compile(
            "^((?:[$€£]?[\\d.,]+\\+)*[$€£]?[\\d.,]+(?: [A-Z]{3})?|Freeroll) (.+)$");

    private static final Pattern POST = Pattern.compile(
            "^posts (the ante|small blind|big blind|small & big blinds) " + AMOUNT + "( and is all-in)?$");

    private final HandGrammar grammar;

    public PokerStarsParser(@Value("${pipeline.parser.default-timezone:UTC}") String defaultTimezone) {
        this.grammar = new HandGrammar(this, defaultTimezone);
    }

    @Override
    public Platform platform() {
        return Platform.POKERSTARS;
    }

    @Override
    public Hand parseHand(String block, String heroName) {
        return grammar.parse(block, heroName);
    }

    @Override
    public Optional<String> tournamentHeader(HandAssembler hand, String description) {
        Matcher tournament = TOURNAMENT.matcher(description);
        if (!tournament.matches()) {
            return Optional.empty();
        }
        Hand.HandBuilder header = hand.header();
        String game = tournament.group(2);
        Matcher buyIn = BUY_IN.matcher(game);
        header.tournamentId(tournament.group(1))
                .level(tournament.group(3))
                .gameFormat(game.contains("Sit & Go") ? GameFormat.SIT_N_GO : GameFormat.TOURNAMENT);
        if (buyIn.matches()) {
            header.stakes(buyIn.group(1)).gameType(buyIn.group(2).strip());
            header.currency(currencyFromBuyIn(buyIn.group(1)));
        } else {
            header.stakes(game).gameType(game);
        }
        hand.blinds(amount(tournament.group(4)), amount(tournament.group(5)));
        return Optional.of(tournament.group(6));
    }

    @Override
    public Pattern postPattern() {
        return POST;
    }

    @Override
    public ActionType postType(String kind) {
        return switch (kind) {
            case "the ante" -> ActionType.POST_ANTE;
            case "small blind" -> ActionType.POST_SMALL_BLIND;
            case "big blind" -> ActionType.POST_BIG_BLIND;
            default -> ActionType.POST_DEAD_BLIND;
        };
    }

    private static String currencyFromBuyIn(String buyIn) {
        if (buyIn.length() > 4 && buyIn.charAt(buyIn.length() - 4) == ' ') {
            return buyIn.substring(buyIn.length() - 3);
        }
        return HandTextSupport.currencyOf(buyIn.isEmpty() ? null : buyIn.substring(0, 1));
    }
}
