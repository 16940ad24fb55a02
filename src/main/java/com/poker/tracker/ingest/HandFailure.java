package com.poker.tracker.ingest;

import lombok.Value;

@Value
public class HandFailure {

    String handId;
    FailureKind kind;
    String reason;
}
