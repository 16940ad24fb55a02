package com.poker.tracker.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.poker.tracker.model.Action;
import com.poker.tracker.model.ActionType;
import com.poker.tracker.model.Blinds;
import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;
import com.poker.tracker.model.Position;
import com.poker.tracker.model.PositionCalculator;
import com.poker.tracker.model.Seat;
import com.poker.tracker.model.SeatOutcome;
import com.poker.tracker.model.Street;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the pieces of one hand block while a grammar walks its lines,
 * tracking stacks and street commitments so every action gets its chip
 * amount and resulting stack. One instance per block, not thread-safe.
 */
public class HandAssembler {

    private final String handId;
    private final Hand.HandBuilder header;

    private final List<Seat> seats = new ArrayList<>();
    private final Map<String, BigDecimal> stacks = new HashMap<>();
    private final Map<String, BigDecimal> committed = new HashMap<>();
    private final Map<String, Integer> pendingTimeBank = new HashMap<>();
    private final List<Action> actions = new ArrayList<>();
    private final List<String> board = new ArrayList<>();
    private final Map<String, BigDecimal> uncalled = new LinkedHashMap<>();
    private final Map<String, BigDecimal> collected = new LinkedHashMap<>();

    private Street street = Street.PREFLOP;
    private BigDecimal highestBet = BigDecimal.ZERO;

    private BigDecimal smallBlind;
    private BigDecimal bigBlind;
    private BigDecimal ante;
    private Integer buttonSeat;

    private String dealtTo;
    private final Map<String, List<String>> dealtCards = new HashMap<>();

    private BigDecimal totalPot;
    private BigDecimal rake = BigDecimal.ZERO;
    private BigDecimal jackpot = BigDecimal.ZERO;
    private boolean showdown;

    public HandAssembler(Platform platform, String handId) {
        this.handId = handId;
        this.header = Hand.builder()
                .platform(platform)
                .handId(handId);
    }

    public String getHandId() {
        return handId;
    }

    /**
     * Builder for the header fields the grammar reads directly.
     */
    public Hand.HandBuilder header() {
        return header;
    }

    public HandParseException fail(String reason) {
        return new HandParseException(handId, reason);
    }

    public Street currentStreet() {
        return street;
    }

    public boolean hasSeats() {
        return !seats.isEmpty();
    }

    public void blinds(BigDecimal small, BigDecimal big) {
        this.smallBlind = small;
        this.bigBlind = big;
    }

    public void button(int seat) {
        this.buttonSeat = seat;
    }

    public void seat(int seatNumber, String player, BigDecimal stack, boolean sittingOut) {
        if (stacks.containsKey(player)) {
            throw fail("Player '" + player + "' seated twice");
        }
        seats.add(Seat.builder()
                .seatNumber(seatNumber)
                .playerName(player)
                .startingStack(stack)
                .sittingOut(sittingOut)
                .build());
        stacks.put(player, stack);
    }

    public void sittingOut(String player) {
        for (int i = 0; i < seats.size(); i++) {
            Seat seat = seats.get(i);
            if (seat.getPlayerName().equals(player) && !seat.isSittingOut()) {
                seats.set(i, seat.toBuilder().sittingOut(true).build());
            }
        }
    }

    /**
     * Finds the seated player whose name, followed by {@code separator}, starts
     * the line. The longest name wins so names that prefix each other resolve.
     */
    public Optional<String> playerPrefix(String line, String separator) {
        String best = null;
        for (Seat seat : seats) {
            String name = seat.getPlayerName();
            if (line.startsWith(name + separator) && (best == null || name.length() > best.length())) {
                best = name;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Records a {@code Dealt to} line. The first player shown with cards is
     * the default hero.
     */
    public void dealt(String player, List<String> cards) {
        requireSeated(player);
        if (!cards.isEmpty()) {
            dealtCards.putIfAbsent(player, cards);
        }
        if (dealtTo == null || (!dealtCards.containsKey(dealtTo) && !cards.isEmpty())) {
            dealtTo = player;
        }
    }

    public void post(String player, ActionType type, BigDecimal amount, boolean allIn) {
        if (!type.isForced()) {
            throw new IllegalArgumentException("Not a forced bet: " + type);
        }
        switch (type) {
            case POST_ANTE -> {
                if (ante == null) {
                    ante = amount;
                }
            }
            case POST_DEAD_BLIND -> {
                // only the big blind part of a dead blind counts as a live bet
                BigDecimal live = bigBlind != null && amount.compareTo(bigBlind) > 0 ? bigBlind : amount;
                commit(player, live);
            }
            default -> commit(player, amount);
        }
        record(player, type, amount, null, allIn);
    }

    public void fold(String player) {
        record(player, ActionType.FOLD, null, null, false);
    }

    public void check(String player) {
        record(player, ActionType.CHECK, null, null, false);
    }

    public void call(String player, BigDecimal amount, boolean allIn) {
        commit(player, amount);
        record(player, ActionType.CALL, amount, null, allIn);
    }

    public void bet(String player, BigDecimal amount, boolean allIn) {
        commit(player, amount);
        record(player, ActionType.BET, amount, null, allIn);
    }

    public void raiseTo(String player, BigDecimal raiseTo, boolean allIn) {
        BigDecimal increment = raiseTo.subtract(committedBy(player));
        if (increment.signum() <= 0) {
            throw fail("Raise to " + raiseTo + " by '" + player + "' does not exceed the street commitment");
        }
        commit(player, increment);
        record(player, ActionType.RAISE, increment, raiseTo, allIn);
    }

    /**
     * Resolves a bare all-in of {@code amount} chips into a bet, call or raise
     * depending on the bet the player is facing.
     */
    public void allIn(String player, BigDecimal amount) {
        BigDecimal total = committedBy(player).add(amount);
        if (total.compareTo(highestBet) <= 0) {
            call(player, amount, true);
        } else if (highestBet.signum() == 0) {
            bet(player, amount, true);
        } else {
            raiseTo(player, total, true);
        }
    }

    public void timeBank(String player, int seconds) {
        pendingTimeBank.merge(player, seconds, Integer::sum);
    }

    /**
     * Moves to a new street. {@code fullBoard} is every community card dealt
     * so far.
     */
    public void street(Street next, List<String> fullBoard) {
        if (next.ordinal() <= street.ordinal()) {
            throw fail("Street " + next + " out of order");
        }
        if (fullBoard.size() != next.getBoardCards()) {
            throw fail("Board for " + next + " has " + fullBoard.size() + " cards");
        }
        board.clear();
        board.addAll(fullBoard);
        street = next;
        committed.clear();
        highestBet = BigDecimal.ZERO;
    }

    public void uncalled(String player, BigDecimal amount) {
        requireSeated(player);
        stacks.merge(player, amount, BigDecimal::add);
        uncalled.merge(player, amount, BigDecimal::add);
    }

    public void collect(String player, BigDecimal amount) {
        requireSeated(player);
        collected.merge(player, amount, BigDecimal::add);
    }

    public void showdown() {
        this.showdown = true;
    }

    public void summary(BigDecimal pot, BigDecimal rake, BigDecimal jackpot) {
        this.totalPot = pot;
        this.rake = rake;
        this.jackpot = jackpot;
    }

    public void board(List<String> cards) {
        if (cards.size() > board.size()) {
            board.clear();
            board.addAll(cards);
        }
    }

    public Hand build(String heroName, String rawText) {
        if (seats.isEmpty()) {
            throw fail("No seats");
        }
        if (buttonSeat == null) {
            throw fail("Missing table line");
        }
        if (bigBlind == null) {
            throw fail("Missing blinds");
        }
        if (totalPot == null) {
            throw fail("Missing pot summary");
        }

        String hero = heroName != null ? heroName : dealtTo;
        if (hero == null) {
            throw fail("Hero not identified");
        }
        Seat heroSeat = seats.stream()
                .filter(s -> s.getPlayerName().equals(hero))
                .findFirst()
                .orElseThrow(() -> fail("Hero '" + hero + "' is not seated"));

        Map<String, Position> positions = PositionCalculator.assign(seats, buttonSeat);

        Map<Integer, SeatOutcome> results = new LinkedHashMap<>();
        for (Seat seat : seats) {
            if (seat.isSittingOut()) {
                continue;
            }
            String player = seat.getPlayerName();
            SeatOutcome outcome;
            if (collected.getOrDefault(player, BigDecimal.ZERO).signum() > 0) {
                outcome = SeatOutcome.WON;
            } else if (actions.stream().anyMatch(a -> a.getPlayer().equals(player)
                    && a.getType() == ActionType.FOLD)) {
                outcome = SeatOutcome.FOLDED;
            } else {
                outcome = SeatOutcome.LOST;
            }
            results.put(seat.getSeatNumber(), outcome);
        }

        return header
                .blinds(Blinds.builder().small(smallBlind).big(bigBlind).ante(ante).build())
                .buttonSeat(buttonSeat)
                .seats(ImmutableList.copyOf(seats))
                .positions(ImmutableMap.copyOf(positions))
                .heroName(hero)
                .heroSeat(heroSeat.getSeatNumber())
                .heroPosition(positions.get(hero))
                .holeCards(ImmutableList.copyOf(dealtCards.getOrDefault(hero, List.of())))
                .heroStartingStack(heroSeat.getStartingStack())
                .actions(ImmutableList.copyOf(actions))
                .boardCards(ImmutableList.copyOf(board))
                .uncalledReturns(ImmutableMap.copyOf(uncalled))
                .collected(ImmutableMap.copyOf(collected))
                .results(ImmutableMap.copyOf(results))
                .totalPot(totalPot)
                .rake(rake)
                .jackpot(jackpot)
                .showdown(showdown)
                .rawText(rawText)
                .build();
    }

    private BigDecimal committedBy(String player) {
        return committed.getOrDefault(player, BigDecimal.ZERO);
    }

    private void commit(String player, BigDecimal amount) {
        requireSeated(player);
        BigDecimal total = committed.merge(player, amount, BigDecimal::add);
        if (total.compareTo(highestBet) > 0) {
            highestBet = total;
        }
    }

    private void requireSeated(String player) {
        if (!stacks.containsKey(player)) {
            throw fail("Unknown player '" + player + "'");
        }
    }

    private void record(String player, ActionType type, BigDecimal amount, BigDecimal raiseTo, boolean allIn) {
        requireSeated(player);
        BigDecimal stack = stacks.get(player);
        if (amount != null) {
            stack = stack.subtract(amount);
            stacks.put(player, stack);
        }
        actions.add(Action.builder()
                .sequence(actions.size() + 1)
                .player(player)
                .street(street)
                .type(type)
                .amount(amount)
                .raiseTo(raiseTo)
                .stackAfter(stack)
                .allIn(allIn)
                .timeUsed(pendingTimeBank.remove(player))
                .build());
    }
}
