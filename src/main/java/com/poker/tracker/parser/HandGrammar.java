package com.poker.tracker.parser;

import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Street;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.poker.tracker.parser.HandTextSupport.AMOUNT;
import static com.poker.tracker.parser.HandTextSupport.amount;
import static com.poker.tracker.parser.HandTextSupport.cards;

/**
 * Section state machine over the lines of one hand block: header, action and
 * summary. Table and seat lines, street markers, the common action verbs and
 * the summary are the same on every supported platform; the rest comes from
 * the {@link PlatformDialect}.
 */
@Slf4j
final class HandGrammar {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy/MM/dd H:mm:ss");

    private static final Pattern CASH = Pattern.compile(
            "^(.+?) \\(([$€£]?)([\\d,.]+)/[$€£]?([\\d,.]+)(?: ([A-Z]{3}))?\\) - (.+)$");
    private static final Pattern DATE = Pattern.compile(
            "^(\\d{4}/\\d{2}/\\d{2} \\d{1,2}:\\d{2}:\\d{2})(?: ([A-Z]{2,4}))?(?: \\[.*])?$");

    private static final Pattern TABLE = Pattern.compile(
            "^Table '(.+)' (\\d+)-max( \\(Play Money\\))? Seat #(\\d+) is the button$");
    private static final Pattern SEAT = Pattern.compile(
            "^Seat (\\d+): (.+?) \\(" + AMOUNT + " in chips[^)]*\\)(.*)$");

    private static final Pattern FOLD = Pattern.compile("^folds(?: \\[.+])?$");
    private static final Pattern CHECK = Pattern.compile("^checks$");
    private static final Pattern CALL = Pattern.compile("^calls " + AMOUNT + "( and is all-in)?$");
    private static final Pattern BET = Pattern.compile("^bets " + AMOUNT + "( and is all-in)?$");
    private static final Pattern RAISE = Pattern.compile(
            "^raises " + AMOUNT + " to " + AMOUNT + "( and is all-in)?$");
    private static final Pattern NOISE = Pattern.compile(
            "^(?:shows|mucks|doesn't show|is sitting out|sits out|is disconnected|is connected"
                    + "|has timed out|has returned|is away|leaves|joins|sits down|stands up).*$");

    private static final Pattern DEALT = Pattern.compile("^Dealt to (.+?)(?: \\[([^\\]]+)])?$");
    private static final Pattern UNCALLED = Pattern.compile("^Uncalled bet \\(" + AMOUNT + "\\) returned to (.+)$");
    private static final Pattern COLLECTED = Pattern.compile("^collected " + AMOUNT + " from .*pot.*$");

    private static final Pattern FLOP = Pattern.compile("^\\*\\*\\* FLOP \\*\\*\\* \\[([^\\]]+)]$");
    private static final Pattern TURN_OR_RIVER = Pattern.compile(
            "^\\*\\*\\* (TURN|RIVER) \\*\\*\\* \\[([^\\]]+)] \\[([^\\]]+)]$");

    private static final Pattern TOTAL_POT = Pattern.compile(
            "^Total pot " + AMOUNT + "(?: .*?)? ?\\| Rake " + AMOUNT + "(.*)$");
    private static final Pattern BOARD = Pattern.compile("^Board \\[([^\\]]+)]$");

    private enum Section { HEADER, ACTION, SUMMARY }

    private final PlatformDialect dialect;
    private final Pattern headerLine;
    private final String defaultTimezone;

    HandGrammar(PlatformDialect dialect, String defaultTimezone) {
        this.dialect = dialect;
        this.headerLine = Pattern.compile(dialect.platform().getHeaderPattern().pattern() + "\\s+(.+)$");
        this.defaultTimezone = defaultTimezone;
    }

    Hand parse(String block, String heroName) {
        List<String> lines = HandTextSupport.lines(block).stream()
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.isEmpty()) {
            throw new HandParseException(null, "Empty hand block");
        }
        Matcher header = headerLine.matcher(lines.get(0));
        if (!header.matches()) {
            throw new HandParseException(HandTextSupport.handIdOf(block, dialect.platform().getHeaderPattern()),
                    "Malformed header line");
        }

        HandAssembler hand = new HandAssembler(dialect.platform(), header.group(1));
        try {
            parseHeader(hand, header.group(2));
            Section section = Section.HEADER;
            for (String line : lines.subList(1, lines.size())) {
                if (line.startsWith("*** ")) {
                    section = marker(hand, line);
                    continue;
                }
                switch (section) {
                    case HEADER -> headerLine(hand, line);
                    case ACTION -> actionLine(hand, line);
                    case SUMMARY -> summaryLine(hand, line);
                }
            }
            return hand.build(heroName, block);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new HandParseException(hand.getHandId(), e.getMessage(), e);
        }
    }

    private void parseHeader(HandAssembler hand, String rest) {
        Hand.HandBuilder header = hand.header();
        Optional<String> tournamentDate = dialect.tournamentHeader(hand, rest);
        String dateText;
        if (tournamentDate.isPresent()) {
            dateText = tournamentDate.get();
        } else {
            Matcher cash = CASH.matcher(rest);
            if (!cash.matches()) {
                throw hand.fail("Unrecognised game description '" + rest + "'");
            }
            String symbol = cash.group(2);
            String currency = cash.group(5) != null ? cash.group(5) : HandTextSupport.currencyOf(symbol);
            header.gameType(cash.group(1).strip())
                    .gameFormat(GameFormat.CASH)
                    .stakes(symbol + cash.group(3) + "/" + symbol + cash.group(4))
                    .currency(currency);
            hand.blinds(amount(cash.group(3)), amount(cash.group(4)));
            dateText = cash.group(6);
        }

        // the first timestamp is the one in the player's local zone
        Matcher date = DATE.matcher(dateText.strip());
        if (!date.matches()) {
            throw hand.fail("Malformed timestamp '" + dateText + "'");
        }
        header.playedAt(LocalDateTime.parse(date.group(1), TIMESTAMP))
                .timezone(date.group(2) != null ? date.group(2) : defaultTimezone);
    }

    private Section marker(HandAssembler hand, String line) {
        switch (line) {
            case "*** HOLE CARDS ***":
                return Section.ACTION;
            case "*** SUMMARY ***":
                return Section.SUMMARY;
            case "*** SHOWDOWN ***":
            case "*** SHOW DOWN ***":
                hand.showdown();
                return Section.ACTION;
            default:
                break;
        }
        Matcher flop = FLOP.matcher(line);
        if (flop.matches()) {
            hand.street(Street.FLOP, cards(flop.group(1)));
            return Section.ACTION;
        }
        Matcher later = TURN_OR_RIVER.matcher(line);
        if (later.matches()) {
            List<String> board = new ArrayList<>(cards(later.group(2)));
            board.addAll(cards(later.group(3)));
            hand.street(Street.valueOf(later.group(1)), board);
            return Section.ACTION;
        }
        throw hand.fail("Unsupported street marker '" + line + "'");
    }

    private void headerLine(HandAssembler hand, String line) {
        Matcher table = TABLE.matcher(line);
        if (table.matches()) {
            hand.header()
                    .tableName(table.group(1))
                    .tableSize(Integer.parseInt(table.group(2)))
                    .playMoney(table.group(3) != null);
            hand.button(Integer.parseInt(table.group(4)));
            return;
        }
        Matcher seat = SEAT.matcher(line);
        if (seat.matches()) {
            hand.seat(Integer.parseInt(seat.group(1)), seat.group(2), amount(seat.group(3)),
                    seat.group(4).contains("sitting out"));
            return;
        }
        Optional<String> actor = hand.playerPrefix(line, ": ");
        if (actor.isPresent()) {
            String player = actor.get();
            String verb = line.substring(player.length() + 2);
            if (post(hand, player, verb)) {
                return;
            }
            if (verb.startsWith("is sitting out") || verb.startsWith("sits out")) {
                hand.sittingOut(player);
            } else if (!ignorable(verb)) {
                throw hand.fail("Unrecognised line before hole cards '" + line + "'");
            }
            return;
        }
        log.debug("Hand {}: skipping '{}'", hand.getHandId(), line);
    }

    private void actionLine(HandAssembler hand, String line) {
        Matcher dealt = DEALT.matcher(line);
        if (dealt.matches()) {
            hand.dealt(dealt.group(1), dealt.group(2) == null ? List.of() : cards(dealt.group(2)));
            return;
        }
        Matcher uncalled = UNCALLED.matcher(line);
        if (uncalled.matches()) {
            hand.uncalled(uncalled.group(2), amount(uncalled.group(1)));
            return;
        }
        Optional<String> collector = hand.playerPrefix(line, " collected ");
        if (collector.isPresent()) {
            Matcher collected = COLLECTED.matcher(line.substring(collector.get().length() + 1));
            if (!collected.matches()) {
                throw hand.fail("Malformed collection line '" + line + "'");
            }
            hand.collect(collector.get(), amount(collected.group(1)));
            return;
        }
        Optional<String> actor = hand.playerPrefix(line, ": ");
        if (actor.isEmpty()) {
            log.debug("Hand {}: skipping '{}'", hand.getHandId(), line);
            return;
        }
        String player = actor.get();
        String verb = line.substring(player.length() + 2);
        Matcher m;
        if (FOLD.matcher(verb).matches()) {
            hand.fold(player);
        } else if (CHECK.matcher(verb).matches()) {
            hand.check(player);
        } else if ((m = CALL.matcher(verb)).matches()) {
            hand.call(player, amount(m.group(1)), m.group(2) != null);
        } else if ((m = BET.matcher(verb)).matches()) {
            hand.bet(player, amount(m.group(1)), m.group(2) != null);
        } else if ((m = RAISE.matcher(verb)).matches()) {
            hand.raiseTo(player, amount(m.group(2)), m.group(3) != null);
        } else if (!dialect.action(hand, player, verb) && !post(hand, player, verb) && !ignorable(verb)) {
            throw hand.fail("Unrecognised action line '" + line + "'");
        }
    }

    private void summaryLine(HandAssembler hand, String line) {
        Matcher pot = TOTAL_POT.matcher(line);
        if (pot.matches()) {
            hand.summary(amount(pot.group(1)), amount(pot.group(2)), dialect.fees(pot.group(3)));
            return;
        }
        Matcher board = BOARD.matcher(line);
        if (board.matches()) {
            hand.board(cards(board.group(1)));
        }
    }

    private boolean post(HandAssembler hand, String player, String verb) {
        Matcher post = dialect.postPattern().matcher(verb);
        if (!post.matches()) {
            return false;
        }
        hand.post(player, dialect.postType(post.group(1)), amount(post.group(2)), post.group(3) != null);
        return true;
    }

    private boolean ignorable(String verb) {
        return NOISE.matcher(verb).matches() || dialect.ignorable(verb);
    }
}
