package com.poker.tracker.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.poker.tracker.model.Position.*;

/**
 * Assigns table positions to the players dealt into a hand, counting
 * clockwise from the button.
 */
public final class PositionCalculator {

    // positions after the big blind, indexed by how many players remain
    private static final List<List<Position>> AFTER_BLINDS = List.of(
            List.of(),
            List.of(CO),
            List.of(MP, CO),
            List.of(UTG, MP, CO),
            List.of(UTG, MP, HJ, CO),
            List.of(UTG, UTG1, MP, HJ, CO),
            List.of(UTG, UTG1, MP, MP1, HJ, CO),
            List.of(UTG, UTG1, UTG2, MP, MP1, HJ, CO)
    );

    private PositionCalculator() {
    }

    public static Map<String, Position> assign(List<Seat> seats, int buttonSeat) {
        List<Seat> dealt = seats.stream()
                .filter(s -> !s.isSittingOut())
                .sorted(Comparator.comparingInt(Seat::getSeatNumber))
                .toList();

        Map<String, Position> positions = new LinkedHashMap<>();
        if (dealt.isEmpty()) {
            return positions;
        }

        // rotate so the button (or the first seat after an empty button) comes first
        int start = 0;
        for (int i = 0; i < dealt.size(); i++) {
            if (dealt.get(i).getSeatNumber() >= buttonSeat) {
                start = i;
                break;
            }
        }
        List<Seat> ordered = new ArrayList<>(dealt.subList(start, dealt.size()));
        ordered.addAll(dealt.subList(0, start));

        if (ordered.size() == 1) {
            positions.put(ordered.get(0).getPlayerName(), BTN);
            return positions;
        }
        if (ordered.size() == 2) {
            positions.put(ordered.get(0).getPlayerName(), BTN);
            positions.put(ordered.get(1).getPlayerName(), BB);
            return positions;
        }

        positions.put(ordered.get(0).getPlayerName(), BTN);
        positions.put(ordered.get(1).getPlayerName(), SB);
        positions.put(ordered.get(2).getPlayerName(), BB);

        int remaining = ordered.size() - 3;
        List<Position> rest = AFTER_BLINDS.get(Math.min(remaining, AFTER_BLINDS.size() - 1));
        for (int i = 0; i < remaining; i++) {
            Position position = i < rest.size() ? rest.get(i) : MP;
            positions.put(ordered.get(3 + i).getPlayerName(), position);
        }
        return positions;
    }
}
