package com.poker.tracker.validation;

public enum ValidationStatus {
    ACCEPTED,
    DUPLICATE,
    REJECTED
}
