package com.poker.tracker.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Normalized, platform-independent record of one played hand.
 * Immutable once built by a parser.
 */
@Value
@Builder(toBuilder = true)
public class Hand {

    Platform platform;
    String handId;

    String gameType;
    GameFormat gameFormat;
    String stakes;
    Blinds blinds;
    String currency;
    boolean playMoney;

    String tableName;
    int tableSize;
    int buttonSeat;

    String tournamentId;
    String level;

    LocalDateTime playedAt;
    String timezone;

    ImmutableList<Seat> seats;
    ImmutableMap<String, Position> positions;

    String heroName;
    int heroSeat;
    Position heroPosition;
    ImmutableList<String> holeCards;
    BigDecimal heroStartingStack;

    ImmutableList<Action> actions;
    ImmutableList<String> boardCards;

    ImmutableMap<String, BigDecimal> uncalledReturns;
    ImmutableMap<String, BigDecimal> collected;
    ImmutableMap<Integer, SeatOutcome> results;

    BigDecimal totalPot;
    BigDecimal rake;
    BigDecimal jackpot;
    boolean showdown;

    String rawText;

    public List<Action> actionsOn(Street street) {
        return actions.stream()
                .filter(a -> a.getStreet() == street)
                .toList();
    }

    public List<Action> actionsBy(String player) {
        return actions.stream()
                .filter(a -> a.getPlayer().equals(player))
                .toList();
    }

    public boolean isStreetDealt(Street street) {
        return boardCards.size() >= street.getBoardCards();
    }

    public Optional<Seat> seatOf(String player) {
        return seats.stream()
                .filter(s -> s.getPlayerName().equals(player))
                .findFirst();
    }

    public BigDecimal collectedBy(String player) {
        return collected.getOrDefault(player, BigDecimal.ZERO);
    }

    public BigDecimal returnedTo(String player) {
        return uncalledReturns.getOrDefault(player, BigDecimal.ZERO);
    }

    public BigDecimal investedBy(String player) {
        return actionsBy(player).stream()
                .map(Action::getAmount)
                .filter(a -> a != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Collected plus uncalled returns minus everything the player put in.
     */
    public BigDecimal netFor(String player) {
        return collectedBy(player).add(returnedTo(player)).subtract(investedBy(player));
    }

    public boolean hasFolded(String player) {
        return actionsBy(player).stream().anyMatch(a -> a.getType() == ActionType.FOLD);
    }
}
