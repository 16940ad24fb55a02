package com.poker.tracker;

/**
 * Root of the pipeline's failure hierarchy.
 */
public class HandHistoryException extends RuntimeException {

    public HandHistoryException(String message) {
        super(message);
    }

    public HandHistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
