package com.poker.tracker.ingest;

import lombok.Value;

@Value
public class ProgressSnapshot {

    int percent;
    String currentStep;
    int handsProcessed;
    int handsFailed;
    int handsExpected;
    boolean done;
}
