package com.poker.tracker.parser;

import com.poker.tracker.HandFixtures;
import com.poker.tracker.model.Action;
import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import com.poker.tracker.model.Position;
import com.poker.tracker.model.Street;
import com.poker.tracker.validation.HandValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GGPokerParser")
class GGPokerParserTest {

    private static final String POSTFLOP_ALL_INS = """
            Poker Hand #RC1000000002: Hold'em No Limit ($0.05/$0.1) - 2024/02/01 18:05:00
            Table 'RushAndCash5' 6-max Seat #1 is the button
            Seat 1: Hero ($10 in chips)
            Seat 2: Shorty ($2 in chips)
            Seat 3: Caller ($1.5 in chips)
            Shorty: posts small blind $0.05
            Caller: posts big blind $0.1
            *** HOLE CARDS ***
            Dealt to Hero [Th Tc]
            Hero: calls $0.1
            Shorty: calls $0.05
            Caller: checks
            *** FLOP *** [2d 7s Kc]
            Shorty: all-in $1.9
            Caller: all-in $1.4
            Hero: folds
            Uncalled bet ($0.5) returned to Shorty
            *** TURN *** [2d 7s Kc] [4h]
            *** RIVER *** [2d 7s Kc 4h] [5c]
            *** SHOWDOWN ***
            Shorty collected $3.1 from pot
            *** SUMMARY ***
            Total pot $3.1 | Rake $0 | Jackpot $0
            Board [2d 7s Kc 4h 5c]
            """;

    private final GGPokerParser parser = new GGPokerParser("UTC");
    private final HandValidator validator = new HandValidator(new BigDecimal("0.01"));

    @Nested
    @DisplayName("Rush & Cash hand")
    class RushAndCash {

        @Test
        @DisplayName("1. Header without timezone uses the default")
        void header() {
            // When
            Hand hand = HandFixtures.ggRush();

            // Then
            assertThat(hand.getPlatform()).isEqualTo(Platform.GGPOKER);
            assertThat(hand.getHandId()).isEqualTo("RC1000000001");
            assertThat(hand.getGameFormat()).isEqualTo(GameFormat.CASH);
            assertThat(hand.getCurrency()).isEqualTo("USD");
            assertThat(hand.getBlinds().getBig()).isEqualByComparingTo("0.1");
            assertThat(hand.getTimezone()).isEqualTo("UTC");
            assertThat(hand.getHeroPosition()).isEqualTo(Position.BTN);
            assertThat(hand.getHoleCards()).containsExactly("Ac", "Ad");
        }

        @Test
        @DisplayName("2. Bare all-in over a raise becomes a raise")
        void allInRaise() {
            // When
            Hand hand = HandFixtures.ggRush();

            // Then
            Action allIn = hand.actionsBy("7f3a2b").get(1);
            assertThat(allIn.getType()).isEqualTo(ActionType.RAISE);
            assertThat(allIn.isAllIn()).isTrue();
            assertThat(allIn.getAmount()).isEqualByComparingTo("3.95");
            assertThat(allIn.getRaiseTo()).isEqualByComparingTo("4.00");
            assertThat(allIn.getStackAfter()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("3. Time bank seconds attach to the next action")
        void timeBank() {
            // When
            Hand hand = HandFixtures.ggRush();

            // Then
            assertThat(hand.actionsBy("7f3a2b")).extracting(Action::getTimeUsed).containsExactly(null, 12);
            assertThat(hand.actionsBy("Hero")).extracting(Action::getTimeUsed).containsOnlyNulls();
        }

        @Test
        @DisplayName("4. Jackpot fees are summed apart from rake")
        void fees() {
            // When
            Hand hand = HandFixtures.ggRush();

            // Then
            assertThat(hand.getTotalPot()).isEqualByComparingTo("8.1");
            assertThat(hand.getRake()).isEqualByComparingTo("0.2");
            assertThat(hand.getJackpot()).isEqualByComparingTo("0.10");
            assertThat(hand.isShowdown()).isTrue();
            assertThat(hand.netFor("Hero")).isEqualByComparingTo("3.80");
            assertThat(validator.check(hand)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tournament hand")
    class Tournament {

        @Test
        @DisplayName("1. Level with ante in parentheses")
        void header() {
            // When
            Hand hand = HandFixtures.ggTournament();

            // Then
            assertThat(hand.getGameFormat()).isEqualTo(GameFormat.TOURNAMENT);
            assertThat(hand.getTournamentId()).isEqualTo("555");
            assertThat(hand.getLevel()).isEqualTo("3");
            assertThat(hand.getBlinds().getSmall()).isEqualByComparingTo("20");
            assertThat(hand.getBlinds().getBig()).isEqualByComparingTo("40");
            assertThat(hand.getBlinds().getAnte()).isEqualByComparingTo("5");
            assertThat(hand.getHeroPosition()).isEqualTo(Position.BB);
        }

        @Test
        @DisplayName("2. Thousands separators and explicit all-in raise")
        void amounts() {
            // When
            Hand hand = HandFixtures.ggTournament();

            // Then
            Action shove = hand.actionsBy("Villain").get(1);
            assertThat(shove.getType()).isEqualTo(ActionType.RAISE);
            assertThat(shove.isAllIn()).isTrue();
            assertThat(shove.getAmount()).isEqualByComparingTo("795");
            assertThat(shove.getStackAfter()).isEqualByComparingTo("0");
            assertThat(hand.getSeats().get(0).getStartingStack()).isEqualByComparingTo("1000");
            assertThat(hand.getTotalPot()).isEqualByComparingTo("1625");
            assertThat(hand.netFor("Hero")).isEqualByComparingTo("825");
            assertThat(validator.check(hand)).isEmpty();
        }
    }

    @Test
    @DisplayName("Bare all-ins on a new street resolve to bet and call")
    void postflopAllIns() {
        // When
        Hand hand = parser.parseHand(POSTFLOP_ALL_INS, null);

        // Then
        List<Action> flop = hand.actionsOn(Street.FLOP);
        assertThat(flop).extracting(Action::getType)
                .containsExactly(ActionType.BET, ActionType.CALL, ActionType.FOLD);
        assertThat(flop.get(0).isAllIn()).isTrue();
        assertThat(flop.get(1).isAllIn()).isTrue();
        assertThat(flop.get(1).getAmount()).isEqualByComparingTo("1.4");
        assertThat(hand.netFor("Shorty")).isEqualByComparingTo("1.6");
        assertThat(validator.check(hand)).isEmpty();
    }

    @Test
    @DisplayName("Configured default timezone applies when the header has none")
    void configuredTimezone() {
        Hand hand = new GGPokerParser("ET").parse(HandFixtures.text(HandFixtures.GG_RUSH), null).getHands().get(0);

        assertThat(hand.getTimezone()).isEqualTo("ET");
    }

    @Test
    @DisplayName("Unknown action verb fails the hand")
    void unknownVerb() {
        // Given
        String text = HandFixtures.text(HandFixtures.GG_RUSH).replace("c91d44: folds", "c91d44: straddles $0.2");

        // When
        ParseResult result = parser.parse(text, null);

        // Then
        assertThat(result.getHands()).isEmpty();
        assertThat(result.getFailures()).singleElement()
                .satisfies(f -> assertThat(f.getHandId()).isEqualTo("RC1000000001"));
    }

    @Test
    @DisplayName("Malformed header is reported without a hand id")
    void malformedHeader() {
        assertThatThrownBy(() -> parser.parseHand("Poker Hand #RC1: garbage", null))
                .isInstanceOf(HandParseException.class);
    }
}
