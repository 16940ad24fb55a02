package com.poker.tracker.validation;

import com.poker.tracker.model.Hand;
import com.poker.tracker.model.Platform;

/**
 * Identity of an imported hand for duplicate detection.
 */
public record HandKey(String user, Platform platform, String handId) {

    public static HandKey of(String user, Hand hand) {
        return new HandKey(user, hand.getPlatform(), hand.getHandId());
    }

    @Override
    public String toString() {
        return user + ":" + platform + ":" + handId;
    }
}
