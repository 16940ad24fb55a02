package com.poker.tracker.ingest;

public enum FailureKind {
    PARSE_ERROR,
    VALIDATION_ERROR
}
