package com.poker.tracker.ingest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ImportProgress")
class ImportProgressTest {

    @Test
    @DisplayName("1. Percent follows processed hands and stops at 99")
    void percent() {
        // Given
        ImportProgress progress = new ImportProgress();
        progress.expect(4);

        // When
        progress.handProcessed(false);
        progress.handProcessed(true);

        // Then
        assertThat(progress.snapshot().getPercent()).isEqualTo(50);
        assertThat(progress.snapshot().getHandsFailed()).isEqualTo(1);

        progress.handProcessed(false);
        progress.handProcessed(false);
        assertThat(progress.snapshot().getPercent()).isEqualTo(99);
        assertThat(progress.snapshot().isDone()).isFalse();

        progress.complete("Completed");
        assertThat(progress.snapshot().getPercent()).isEqualTo(100);
        assertThat(progress.snapshot().isDone()).isTrue();
        assertThat(progress.snapshot().getCurrentStep()).isEqualTo("Completed");
    }

    @Test
    @DisplayName("2. More hands than expected never push percent back")
    void moreHandsThanExpected() {
        // Given
        ImportProgress progress = new ImportProgress();
        progress.expect(1);
        List<Integer> seen = new ArrayList<>();
        progress.addListener(s -> seen.add(s.getPercent()));

        // When
        for (int i = 0; i < 5; i++) {
            progress.handProcessed(false);
        }

        // Then
        assertThat(seen).isSorted().containsOnly(99);
        assertThat(progress.snapshot().getHandsProcessed()).isEqualTo(5);
    }

    @Test
    @DisplayName("3. A failing listener does not break progress")
    void failingListener() {
        ImportProgress progress = new ImportProgress();
        progress.addListener(s -> {
            throw new IllegalStateException("boom");
        });

        progress.step("Importing hands");

        assertThat(progress.snapshot().getCurrentStep()).isEqualTo("Importing hands");
    }

    @Test
    @DisplayName("4. Concurrent workers: readers never see percent go down")
    void concurrentUpdates() throws Exception {
        // Given
        ImportProgress progress = new ImportProgress();
        progress.expect(1000);
        ExecutorService workers = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean decreased = new AtomicBoolean(false);

        Thread reader = new Thread(() -> {
            int last = 0;
            while (!progress.snapshot().isDone()) {
                int percent = progress.snapshot().getPercent();
                if (percent < last) {
                    decreased.set(true);
                }
                last = percent;
            }
        });
        reader.start();

        // When
        for (int w = 0; w < 4; w++) {
            workers.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 250; i++) {
                    progress.handProcessed(i % 10 == 0);
                }
            });
        }
        start.countDown();
        workers.shutdown();
        assertThat(workers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        ProgressSnapshot beforeComplete = progress.snapshot();
        progress.complete("Completed");
        reader.join(5000);

        // Then
        assertThat(beforeComplete.getHandsProcessed()).isEqualTo(1000);
        assertThat(beforeComplete.getHandsFailed()).isEqualTo(100);
        assertThat(beforeComplete.getPercent()).isEqualTo(99);
        assertThat(decreased).isFalse();
    }

    @Test
    @DisplayName("5. Concurrent workers: listeners receive snapshots in order")
    void listenersSeeOrderedSnapshots() throws Exception {
        // Given
        int workers = 4;
        int handsPerWorker = 10_000;
        ImportProgress progress = new ImportProgress();
        progress.expect(workers * handsPerWorker);
        List<Integer> processed = new ArrayList<>();
        progress.addListener(s -> processed.add(s.getHandsProcessed()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);

        // When
        for (int w = 0; w < workers; w++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < handsPerWorker; i++) {
                    progress.handProcessed(false);
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(processed).hasSize(workers * handsPerWorker);
        assertThat(processed).isSorted();
        assertThat(processed).doesNotHaveDuplicates();
        assertThat(processed.get(processed.size() - 1)).isEqualTo(workers * handsPerWorker);
    }
}
