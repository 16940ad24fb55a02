package com.poker.tracker.model;

public enum GameFormat {
    CASH,
    TOURNAMENT,
    SIT_N_GO
}
