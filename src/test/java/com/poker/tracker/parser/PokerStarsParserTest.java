package com.poker.tracker.parser;

import com.poker.tracker.HandFixtures;
import com.poker.tracker.model.Action;
import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.GameFormat;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import com.poker.tracker.model.Position;
import com.poker.tracker.model.SeatOutcome;
import com.poker.tracker.model.Street;
import com.poker.tracker.validation.HandValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PokerStarsParser")
class PokerStarsParserTest {

    private static final String TOURNAMENT_HAND = """
            PokerStars Hand #240000000001: Tournament #3456789012, $10+$1 USD Hold'em No Limit - Level II (15/30) - 2024/03/01 21:00:00 CET [2024/03/01 15:00:00 ET]
            Table '3456789012 1' 9-max Seat #1 is the button
            Seat 1: Hero (1500 in chips)
            Seat 2: Villain (1500 in chips)
            Seat 3: Third (1500 in chips)
            Hero: posts the ante 5
            Villain: posts the ante 5
            Third: posts the ante 5
            Villain: posts small blind 15
            Third: posts big blind 30
            *** HOLE CARDS ***
            Dealt to Hero [Js Jd]
            Hero: raises 60 to 90
            Villain: folds
            Third: folds
            Uncalled bet (60) returned to Hero
            Hero collected 90 from pot
            Hero: doesn't show hand
            *** SUMMARY ***
            Total pot 90 | Rake 0
            Seat 1: Hero (button) collected (90)
            """;

    private static final String PLAY_MONEY_HAND = """
            PokerStars Game #27853949451: Hold'em No Limit (25/50) - 2024/03/02 12:00:00 ET
            Table 'Ariadne II' 9-max (Play Money) Seat #1 is the button
            Seat 1: Hero (5000 in chips)
            Seat 2: Villain (5000 in chips)
            Hero: posts small blind 25
            Villain: posts big blind 50
            *** HOLE CARDS ***
            Dealt to Hero [7h 2c]
            Hero: folds
            Uncalled bet (25) returned to Villain
            Villain collected 50 from pot
            *** SUMMARY ***
            Total pot 50 | Rake 0
            """;

    private final PokerStarsParser parser = new PokerStarsParser("UTC");
    private final HandValidator validator = new HandValidator(new BigDecimal("0.01"));

    @Nested
    @DisplayName("Cash game hand")
    class CashGame {

        @Test
        @DisplayName("1. Header fields")
        void headerFields() {
            // When
            Hand hand = HandFixtures.headsUp();

            // Then
            assertThat(hand.getPlatform()).isEqualTo(Platform.POKERSTARS);
            assertThat(hand.getHandId()).isEqualTo("230000000001");
            assertThat(hand.getGameType()).isEqualTo("Hold'em No Limit");
            assertThat(hand.getGameFormat()).isEqualTo(GameFormat.CASH);
            assertThat(hand.getStakes()).isEqualTo("$0.25/$0.50");
            assertThat(hand.getCurrency()).isEqualTo("USD");
            assertThat(hand.getBlinds().getSmall()).isEqualByComparingTo("0.25");
            assertThat(hand.getBlinds().getBig()).isEqualByComparingTo("0.50");
            assertThat(hand.getBlinds().getAnte()).isNull();
            assertThat(hand.getPlayedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 20, 30));
            assertThat(hand.getTimezone()).isEqualTo("ET");
            assertThat(hand.getTableName()).isEqualTo("Alcor II");
            assertThat(hand.getTableSize()).isEqualTo(2);
            assertThat(hand.getButtonSeat()).isEqualTo(1);
            assertThat(hand.isPlayMoney()).isFalse();
        }

        @Test
        @DisplayName("2. Hero, positions and hole cards")
        void heroAndPositions() {
            // When
            Hand hand = HandFixtures.headsUp();

            // Then
            assertThat(hand.getHeroName()).isEqualTo("Hero");
            assertThat(hand.getHeroSeat()).isEqualTo(1);
            assertThat(hand.getHeroPosition()).isEqualTo(Position.BTN);
            assertThat(hand.getPositions()).containsEntry("Villain", Position.BB);
            assertThat(hand.getHoleCards()).containsExactly("Ah", "Kd");
            assertThat(hand.getHeroStartingStack()).isEqualByComparingTo("50.00");
        }

        @Test
        @DisplayName("3. Actions carry amounts and resulting stacks")
        void actions() {
            // When
            Hand hand = HandFixtures.headsUp();

            // Then
            assertThat(hand.getActions()).hasSize(12);
            assertThat(hand.actionsOn(Street.PREFLOP)).hasSize(4);
            assertThat(hand.actionsOn(Street.RIVER)).extracting(Action::getType)
                    .containsExactly(ActionType.CHECK, ActionType.BET, ActionType.FOLD);

            Action raise = hand.getActions().get(2);
            assertThat(raise.getType()).isEqualTo(ActionType.RAISE);
            assertThat(raise.getAmount()).isEqualByComparingTo("1.75");
            assertThat(raise.getRaiseTo()).isEqualByComparingTo("2");
            assertThat(raise.getStackAfter()).isEqualByComparingTo("48.00");

            Action riverBet = hand.actionsOn(Street.RIVER).get(1);
            assertThat(riverBet.getStackAfter()).isEqualByComparingTo("41.25");
            assertThat(hand.getActions()).extracting(Action::getSequence)
                    .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
        }

        @Test
        @DisplayName("4. Board, pot and results")
        void summary() {
            // When
            Hand hand = HandFixtures.headsUp();

            // Then
            assertThat(hand.getBoardCards()).containsExactly("Kc", "7d", "2h", "5s", "9c");
            assertThat(hand.getUncalledReturns().get("Hero")).isEqualByComparingTo("4.50");
            assertThat(hand.collectedBy("Hero")).isEqualByComparingTo("8.10");
            assertThat(hand.getTotalPot()).isEqualByComparingTo("8.50");
            assertThat(hand.getRake()).isEqualByComparingTo("0.40");
            assertThat(hand.getJackpot()).isEqualByComparingTo("0");
            assertThat(hand.isShowdown()).isFalse();
            assertThat(hand.getResults())
                    .containsEntry(1, SeatOutcome.WON)
                    .containsEntry(2, SeatOutcome.FOLDED);
            assertThat(hand.netFor("Hero")).isEqualByComparingTo("3.85");
            assertThat(validator.check(hand)).isEmpty();
        }

        @Test
        @DisplayName("5. Explicit hero name overrides the dealt player")
        void heroOverride() {
            // When
            Hand hand = HandFixtures.headsUpAs("Villain");

            // Then
            assertThat(hand.getHeroName()).isEqualTo("Villain");
            assertThat(hand.getHeroPosition()).isEqualTo(Position.BB);
            assertThat(hand.getHoleCards()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Multi-hand file")
    class MultiHandFile {

        @Test
        @DisplayName("1. A broken hand is reported without losing the others")
        void brokenHandIsIsolated() {
            // When
            ParseResult result = parser.parse(HandFixtures.text(HandFixtures.SESSION), null);

            // Then
            assertThat(result.getHands()).extracting(Hand::getHandId)
                    .containsExactly(HandFixtures.WALK_ID, HandFixtures.FOLD_TO_THREE_BET_ID,
                            HandFixtures.CHECK_RAISE_ID, HandFixtures.BAD_POT_ID);
            assertThat(result.getFailures()).hasSize(1);
            ParseFailure failure = result.getFailures().get(0);
            assertThat(failure.getHandId()).isEqualTo(HandFixtures.UNPARSEABLE_ID);
            assertThat(failure.getReason()).contains("Unrecognised action line", "juggles chips");
        }

        @Test
        @DisplayName("2. Six-handed positions follow the button")
        void sixHandedPositions() {
            // When
            Hand hand = HandFixtures.session(HandFixtures.FOLD_TO_THREE_BET_ID);

            // Then
            assertThat(hand.getPositions())
                    .containsEntry("Carol", Position.BTN)
                    .containsEntry("Dave", Position.SB)
                    .containsEntry("Erin", Position.BB)
                    .containsEntry("Alice", Position.UTG)
                    .containsEntry("Bob", Position.MP)
                    .containsEntry("Hero", Position.CO);
        }

        @Test
        @DisplayName("3. Showdown marker is recorded")
        void showdown() {
            Hand hand = HandFixtures.session(HandFixtures.CHECK_RAISE_ID);

            assertThat(hand.isShowdown()).isTrue();
            assertThat(hand.getResults()).containsEntry(3, SeatOutcome.WON).containsEntry(1, SeatOutcome.LOST);
        }
    }

    @Nested
    @DisplayName("Other formats")
    class OtherFormats {

        @Test
        @DisplayName("1. Tournament header, antes and level")
        void tournament() {
            // When
            Hand hand = parser.parseHand(TOURNAMENT_HAND, null);

            // Then
            assertThat(hand.getGameFormat()).isEqualTo(GameFormat.TOURNAMENT);
            assertThat(hand.getTournamentId()).isEqualTo("3456789012");
            assertThat(hand.getLevel()).isEqualTo("II");
            assertThat(hand.getStakes()).isEqualTo("$10+$1 USD");
            assertThat(hand.getCurrency()).isEqualTo("USD");
            assertThat(hand.getBlinds().getSmall()).isEqualByComparingTo("15");
            assertThat(hand.getBlinds().getBig()).isEqualByComparingTo("30");
            assertThat(hand.getBlinds().getAnte()).isEqualByComparingTo("5");
            assertThat(hand.getTimezone()).isEqualTo("CET");
            assertThat(hand.getPlayedAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 21, 0));
            assertThat(hand.actionsOn(Street.PREFLOP)).filteredOn(a -> a.getType() == ActionType.POST_ANTE)
                    .hasSize(3);
            assertThat(hand.netFor("Hero")).isEqualByComparingTo("55");
            assertThat(validator.check(hand)).isEmpty();
        }

        @Test
        @DisplayName("2. Play money table")
        void playMoney() {
            // When
            Hand hand = parser.parseHand(PLAY_MONEY_HAND, null);

            // Then
            assertThat(hand.isPlayMoney()).isTrue();
            assertThat(hand.getCurrency()).isNull();
            assertThat(hand.getStakes()).isEqualTo("25/50");
            assertThat(hand.netFor("Villain")).isEqualByComparingTo("25");
            assertThat(validator.check(hand)).isEmpty();
        }

        @Test
        @DisplayName("3. Missing timezone falls back to the configured default")
        void defaultTimezone() {
            // Given
            String text = PLAY_MONEY_HAND.replace("12:00:00 ET", "12:00:00");

            // When
            Hand hand = new PokerStarsParser("Europe/Kyiv").parseHand(text, null);

            // Then
            assertThat(hand.getTimezone()).isEqualTo("Europe/Kyiv");
        }
    }

    @Nested
    @DisplayName("Rejected hands")
    class Rejected {

        @Test
        @DisplayName("1. Short flop")
        void shortFlop() {
            // Given
            String text = HandFixtures.text(HandFixtures.HEADS_UP)
                    .replace("*** FLOP *** [Kc 7d 2h]", "*** FLOP *** [Kc 7d]");

            // When / Then
            assertThatThrownBy(() -> parser.parseHand(text, null))
                    .isInstanceOf(HandParseException.class)
                    .hasMessageContaining("230000000001")
                    .hasMessageContaining("Board for FLOP has 2 cards");
        }

        @Test
        @DisplayName("2. Missing summary")
        void missingSummary() {
            // Given
            String text = HandFixtures.text(HandFixtures.HEADS_UP)
                    .replace("Total pot $8.50 | Rake $0.40", "");

            // When / Then
            assertThatThrownBy(() -> parser.parseHand(text, null))
                    .isInstanceOf(HandParseException.class)
                    .hasMessageContaining("Missing pot summary");
        }

        @Test
        @DisplayName("3. Run it twice is not supported")
        void runItTwice() {
            // Given
            String text = HandFixtures.text(HandFixtures.HEADS_UP)
                    .replace("*** FLOP *** [Kc 7d 2h]", "*** FIRST FLOP *** [Kc 7d 2h]");

            // When / Then
            assertThatThrownBy(() -> parser.parseHand(text, null))
                    .isInstanceOf(HandParseException.class)
                    .hasMessageContaining("Unsupported street marker");
        }

        @Test
        @DisplayName("4. Unknown hero")
        void unknownHero() {
            assertThatThrownBy(() -> HandFixtures.headsUpAs("Nobody"))
                    .isInstanceOf(HandParseException.class)
                    .hasMessageContaining("is not seated");
        }

        @Test
        @DisplayName("5. Malformed card")
        void malformedCard() {
            // Given
            String text = HandFixtures.text(HandFixtures.HEADS_UP).replace("Dealt to Hero [Ah Kd]", "Dealt to Hero [Ah Kx]");

            // When / Then
            assertThatThrownBy(() -> parser.parseHand(text, null))
                    .isInstanceOf(HandParseException.class)
                    .hasMessageContaining("Malformed card");
        }
    }
}
