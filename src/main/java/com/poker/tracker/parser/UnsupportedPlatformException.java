package com.poker.tracker.parser;

import com.poker.tracker.HandHistoryException;

public class UnsupportedPlatformException extends HandHistoryException {

    public UnsupportedPlatformException(String message) {
        super(message);
    }
}
