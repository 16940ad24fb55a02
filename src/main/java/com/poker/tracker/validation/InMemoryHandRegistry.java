package com.poker.tracker.validation;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryHandRegistry implements HandRegistry {

    private final Set<HandKey> keys = ConcurrentHashMap.newKeySet();

    @Override
    public boolean register(HandKey key) {
        return keys.add(key);
    }

    @Override
    public boolean contains(HandKey key) {
        return keys.contains(key);
    }

    public int size() {
        return keys.size();
    }
}
