package com.poker.tracker.validation;

/**
 * Set of hands already imported, owned by the caller of the validator.
 */
public interface HandRegistry {

    /**
     * Atomically registers the key.
     *
     * @return true if the key was new, false if it was already registered
     */
    boolean register(HandKey key);

    boolean contains(HandKey key);
}
