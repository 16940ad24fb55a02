package com.poker.tracker.parser;

import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.poker.tracker.parser.HandTextSupport.AMOUNT;
import static com.poker.tracker.parser.HandTextSupport.amount;

/**
 * Grammar for GGPoker / GGNetwork hand histories. Differs from PokerStars in
 * its bare all-in lines, time bank lines and jackpot fees in the summary.
 */
@Component
public class GGPokerParser implements HandHistoryParser, PlatformDialect {

    private static final Pattern TOURNAMENT = Pattern.compile(
            "^Tournament #(\\d+), (.+?) - Level ?(\\d+) ?\\(([\\d,.]+)/([\\d,.]+)(?:\\(([\\d,.]+)\\))?\\) - (.+)$");

    private static final Pattern POST = Pattern.compile(
            "^posts (ante|the ante|small blind|big blind|small & big blinds|dead blind|missed blind) "
                    + AMOUNT + "( and is all-in)?$");
    private static final Pattern ALL_IN = Pattern.compile("^all-in " + AMOUNT + "$");
    private static final Pattern TIME_BANK = Pattern.compile("^uses time bank \\((\\d+)s\\)$");
    private static final Pattern TABLE_EVENTS = Pattern.compile("^(?:[Rr]eceives|[Cc]hooses).*$");

    private static final Pattern FEE = Pattern.compile("\\| (Jackpot|Bingo|Fortune|Tax) " + AMOUNT);

    private final HandGrammar grammar;

    public GGPokerParser(@Value("${pipeline.parser.default-timezone:UTC}") String defaultTimezone) {
        this.grammar = new HandGrammar(this, defaultTimezone);
    }

    @Override
    public Platform platform() {
        return Platform.GGPOKER;
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
        String game = tournament.group(2);
        boolean sitAndGo = game.contains("Sit & Go") || hand.getHandId().startsWith("SG");
        hand.header()
                .tournamentId(tournament.group(1))
                .level(tournament.group(3))
                .gameFormat(sitAndGo ? GameFormat.SIT_N_GO : GameFormat.TOURNAMENT)
                .stakes(game)
                .gameType(game);
        hand.blinds(amount(tournament.group(4)), amount(tournament.group(5)));
        return Optional.of(tournament.group(7));
    }

    @Override
    public Pattern postPattern() {
        return POST;
    }

    @Override
    public ActionType postType(String kind) {
        return switch (kind) {
            case "ante", "the ante" -> ActionType.POST_ANTE;
            case "small blind" -> ActionType.POST_SMALL_BLIND;
            case "big blind" -> ActionType.POST_BIG_BLIND;
            default -> ActionType.POST_DEAD_BLIND;
        };
    }

    @Override
    public boolean action(HandAssembler hand, String player, String verb) {
        Matcher m;
        if ((m = ALL_IN.matcher(verb)).matches()) {
            hand.allIn(player, amount(m.group(1)));
            return true;
        }
        if ((m = TIME_BANK.matcher(verb)).matches()) {
            hand.timeBank(player, Integer.parseInt(m.group(1)));
            return true;
        }
        return false;
    }

    @Override
    public boolean ignorable(String verb) {
        return TABLE_EVENTS.matcher(verb).matches();
    }

    // bingo, fortune and tax are taken from the pot like the jackpot fee
    @Override
    public BigDecimal fees(String potLineTail) {
        BigDecimal fees = BigDecimal.ZERO;
        Matcher fee = FEE.matcher(potLineTail);
        while (fee.find()) {
            fees = fees.add(amount(fee.group(2)));
        }
        return fees;
    }
}
