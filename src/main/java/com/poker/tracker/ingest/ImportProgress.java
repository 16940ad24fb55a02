package com.poker.tracker.ingest;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Progress of one import, shared by its workers. Every update replaces the
 * whole snapshot atomically, so readers never see a torn state and the
 * percentage never goes down. It stays at 99 or below until {@link #complete}.
 * Updates and listener notifications happen under one lock, so listeners
 * receive snapshots in the order they were made.
 */
@Slf4j
public class ImportProgress {

    private final AtomicReference<ProgressSnapshot> state =
            new AtomicReference<>(new ProgressSnapshot(0, "Queued", 0, 0, 0, false));
    private final List<Consumer<ProgressSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final Object updateLock = new Object();

    public ProgressSnapshot snapshot() {
        return state.get();
    }

    public void addListener(Consumer<ProgressSnapshot> listener) {
        listeners.add(listener);
    }

    public void expect(int hands) {
        update(s -> new ProgressSnapshot(s.getPercent(), s.getCurrentStep(), s.getHandsProcessed(),
                s.getHandsFailed(), hands, s.isDone()));
    }

    public void step(String step) {
        update(s -> new ProgressSnapshot(s.getPercent(), step, s.getHandsProcessed(),
                s.getHandsFailed(), s.getHandsExpected(), s.isDone()));
    }

    public void handProcessed(boolean failed) {
        update(s -> {
            int processed = s.getHandsProcessed() + 1;
            int expected = Math.max(s.getHandsExpected(), processed);
            int percent = Math.max(s.getPercent(), Math.min(99, processed * 100 / expected));
            return new ProgressSnapshot(percent, s.getCurrentStep(), processed,
                    s.getHandsFailed() + (failed ? 1 : 0), s.getHandsExpected(), s.isDone());
        });
    }

    public void complete(String step) {
        update(s -> new ProgressSnapshot(100, step, s.getHandsProcessed(), s.getHandsFailed(),
                s.getHandsExpected(), true));
    }

    private void update(UnaryOperator<ProgressSnapshot> change) {
        synchronized (updateLock) {
            notifyListeners(state.updateAndGet(change));
        }
    }

    private void notifyListeners(ProgressSnapshot current) {
        for (Consumer<ProgressSnapshot> listener : listeners) {
            try {
                listener.accept(current);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed: {}", e.getMessage());
            }
        }
    }
}
