package com.poker.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class Seat {

    int seatNumber;
    String playerName;
    BigDecimal startingStack;
    boolean sittingOut;
}
