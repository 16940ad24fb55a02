package com.poker.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Blinds {

    BigDecimal small;
    BigDecimal big;

    // null when the hand had no ante
    BigDecimal ante;
}
