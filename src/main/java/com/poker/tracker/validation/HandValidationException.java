package com.poker.tracker.validation;

import com.poker.tracker.HandHistoryException;
import lombok.Getter;

import java.util.List;

@Getter
public class HandValidationException extends HandHistoryException {

    private final String handId;
    private final List<String> reasons;

    public HandValidationException(String handId, List<String> reasons) {
        super("Hand " + handId + " failed validation: " + String.join("; ", reasons));
        this.handId = handId;
        this.reasons = List.copyOf(reasons);
    }
}
