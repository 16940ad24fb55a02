package com.poker.tracker.validation;

import com.poker.tracker.model.Action;
import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Seat;
import com.poker.tracker.model.Street;
import com.poker.tracker.parser.HandTextSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural and arithmetic checks on a parsed hand, followed by duplicate
 * detection against a caller-owned registry.
 */
@Slf4j
@Component
public class HandValidator {

    private final BigDecimal tolerance;

    public HandValidator(@Value("${pipeline.validation.tolerance:0.01}") BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * Validates the hand and, if it is consistent, registers it for the user.
     * A hand registered before comes back as DUPLICATE.
     */
    public ValidationResult validate(Hand hand, String user, HandRegistry registry) {
        List<String> problems = check(hand);
        if (!problems.isEmpty()) {
            log.debug("Hand {} rejected: {}", hand.getHandId(), problems);
            return ValidationResult.rejected(problems);
        }
        if (!registry.register(HandKey.of(user, hand))) {
            return ValidationResult.duplicate();
        }
        return ValidationResult.accepted();
    }

    /**
     * Throws unless the hand passes every consistency check. Does not touch
     * any registry.
     */
    public void requireValid(Hand hand) {
        List<String> problems = check(hand);
        if (!problems.isEmpty()) {
            throw new HandValidationException(hand.getHandId(), problems);
        }
    }

    /**
     * All consistency problems of the hand, empty when it is valid.
     */
    public List<String> check(Hand hand) {
        List<String> problems = new ArrayList<>();
        checkOrdering(hand, problems);
        boolean referencesOk = checkReferences(hand, problems);
        if (referencesOk) {
            checkArithmetic(hand, problems);
        }
        checkCards(hand, problems);
        return problems;
    }

    private void checkOrdering(Hand hand, List<String> problems) {
        int previousSequence = 0;
        Street previousStreet = Street.PREFLOP;
        boolean voluntarySeen = false;
        Set<String> folded = new HashSet<>();

        for (Action action : hand.getActions()) {
            String where = "action " + action.getSequence();
            if (action.getSequence() <= previousSequence) {
                problems.add(where + ": sequence does not increase");
            }
            previousSequence = action.getSequence();

            if (action.getStreet().ordinal() < previousStreet.ordinal()) {
                problems.add(where + ": street " + action.getStreet() + " after " + previousStreet);
            } else {
                previousStreet = action.getStreet();
            }

            ActionType type = action.getType();
            if (type.isForced()) {
                if (action.getStreet() != Street.PREFLOP) {
                    problems.add(where + ": forced bet after preflop");
                } else if (voluntarySeen) {
                    problems.add(where + ": forced bet after a voluntary action");
                }
            } else {
                voluntarySeen = true;
            }

            if (!hand.isStreetDealt(action.getStreet())) {
                problems.add(where + ": action on " + action.getStreet() + " but board has "
                        + hand.getBoardCards().size() + " cards");
            }

            if (folded.contains(action.getPlayer())) {
                problems.add(where + ": " + action.getPlayer() + " acts after folding");
            }
            if (type == ActionType.FOLD) {
                folded.add(action.getPlayer());
            }

            if (type.carriesAmount()) {
                if (action.getAmount() == null || action.getAmount().signum() <= 0) {
                    problems.add(where + ": " + type + " needs a positive amount");
                }
            } else if (action.getAmount() != null) {
                problems.add(where + ": " + type + " must not carry an amount");
            }
        }
    }

    private boolean checkReferences(Hand hand, List<String> problems) {
        Set<String> seated = new HashSet<>();
        for (Seat seat : hand.getSeats()) {
            seated.add(seat.getPlayerName());
        }
        int before = problems.size();

        boolean heroSeated = hand.getSeats().stream()
                .anyMatch(s -> s.getSeatNumber() == hand.getHeroSeat()
                        && s.getPlayerName().equals(hand.getHeroName()));
        if (!heroSeated) {
            problems.add("hero " + hand.getHeroName() + " is not in seat " + hand.getHeroSeat());
        }
        Set<String> unknown = new HashSet<>();
        for (Action action : hand.getActions()) {
            if (!seated.contains(action.getPlayer()) && unknown.add(action.getPlayer())) {
                problems.add("unknown player " + action.getPlayer());
            }
        }
        for (String player : hand.getCollected().keySet()) {
            if (!seated.contains(player) && unknown.add(player)) {
                problems.add("unknown player " + player);
            }
        }
        for (String player : hand.getUncalledReturns().keySet()) {
            if (!seated.contains(player) && unknown.add(player)) {
                problems.add("unknown player " + player);
            }
        }
        return problems.size() == before;
    }

    private void checkArithmetic(Hand hand, List<String> problems) {
        Map<String, BigDecimal> stacks = new HashMap<>();
        for (Seat seat : hand.getSeats()) {
            stacks.put(seat.getPlayerName(), seat.getStartingStack());
        }

        BigDecimal wagered = BigDecimal.ZERO;
        for (Action action : hand.getActions()) {
            if (action.getAmount() == null) {
                continue;
            }
            wagered = wagered.add(action.getAmount());
            BigDecimal stack = stacks.merge(action.getPlayer(), action.getAmount().negate(), BigDecimal::add);
            if (stack.compareTo(tolerance.negate()) < 0) {
                problems.add("action " + action.getSequence() + ": " + action.getPlayer()
                        + " puts in more than the stack held");
            }
            if (action.getStackAfter() != null && !within(stack, action.getStackAfter())) {
                problems.add("action " + action.getSequence() + ": stack after is "
                        + action.getStackAfter() + ", replay gives " + stack);
            }
        }

        BigDecimal returned = sum(hand.getUncalledReturns().values());
        BigDecimal pot = hand.getTotalPot();
        if (pot == null) {
            problems.add("missing pot total");
            return;
        }
        if (!within(wagered.subtract(returned), pot)) {
            problems.add("pot " + pot + " does not match wagered " + wagered + " less returned " + returned);
        }

        BigDecimal rake = zeroIfNull(hand.getRake());
        BigDecimal jackpot = zeroIfNull(hand.getJackpot());
        if (rake.signum() < 0 || jackpot.signum() < 0) {
            problems.add("negative rake or jackpot");
        }
        BigDecimal collected = sum(hand.getCollected().values());
        if (!within(pot.subtract(rake).subtract(jackpot), collected)) {
            problems.add("collected " + collected + " does not match pot " + pot
                    + " less rake " + rake + " and jackpot " + jackpot);
        }
    }

    private void checkCards(Hand hand, List<String> problems) {
        if (hand.getBoardCards().size() > 5) {
            problems.add("board has " + hand.getBoardCards().size() + " cards");
        }
        Set<String> seen = new HashSet<>();
        List<String> cards = new ArrayList<>(hand.getHoleCards());
        cards.addAll(hand.getBoardCards());
        for (String card : cards) {
            if (!HandTextSupport.CARD.matcher(card).matches()) {
                problems.add("malformed card " + card);
            } else if (!seen.add(card)) {
                problems.add("card " + card + " appears twice");
            }
        }
    }

    private boolean within(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(tolerance) <= 0;
    }

    private static BigDecimal sum(Iterable<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total;
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
