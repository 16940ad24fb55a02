package com.poker.tracker.parser;

import com.poker.tracker.HandHistoryException;
import lombok.Getter;

/**
 * Raised when a hand block cannot be parsed with confidence.
 */
@Getter
public class HandParseException extends HandHistoryException {

    // null when the header itself could not be read
    private final String handId;

    public HandParseException(String handId, String message) {
        super(handId == null ? message : "Hand " + handId + ": " + message);
        this.handId = handId;
    }

    public HandParseException(String handId, String message, Throwable cause) {
        super(handId == null ? message : "Hand " + handId + ": " + message, cause);
        this.handId = handId;
    }
}
