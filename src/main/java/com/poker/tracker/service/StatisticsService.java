package com.poker.tracker.service;

import com.poker.tracker.HandHistoryException;
import com.poker.tracker.model.Hand;
import com.poker.tracker.persistence.StatisticsStore;
import com.poker.tracker.persistence.StoredStatistics;
import com.poker.tracker.stats.Statistics;
import com.poker.tracker.stats.StatisticsAggregator;
import com.poker.tracker.stats.StatisticsFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Serves statistics from cached counters, folding new hands in incrementally
 * and falling back to a full recomputation when the cache has nothing usable.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatisticsService {

    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final StatisticsAggregator aggregator;
    private final StatisticsStore store;

    /**
     * @param history every hand of the user, only loaded on a cache miss
     */
    public Statistics getStatistics(String user, StatisticsFilter filter,
                                    Supplier<? extends Collection<Hand>> history) {
        filter.validate();
        Optional<Statistics> cached = cached(user, filter);
        if (cached.isPresent()) {
            log.debug("Statistics cache hit for {} (generation {})", user, cached.get().getGeneration());
            return cached.get();
        }
        return recompute(user, filter, history);
    }

    /**
     * Folds newly imported hands into the cached statistics. When another
     * writer updates the same entry first, the fold is redone on top of its
     * result; after repeated conflicts the statistics are recomputed.
     *
     * @param delta   hands added since the cached generation
     * @param history every hand of the user including the delta, used on a miss
     */
    public Statistics recordNewHands(String user, StatisticsFilter filter, Collection<Hand> delta,
                                     Supplier<? extends Collection<Hand>> history) {
        filter.validate();
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<Statistics> cached = cached(user, filter);
            if (cached.isEmpty()) {
                return recompute(user, filter, history);
            }
            Statistics updated = aggregator.update(cached.get(), delta);
            if (store.compareAndWrite(user, filter, cached.get().getGeneration(),
                    updated.getGeneration(), updated.getCounters())) {
                log.info("Statistics for {} updated with {} hands (generation {})",
                        user, delta.size(), updated.getGeneration());
                return updated;
            }
            log.info("Statistics for {} changed during update, retrying ({}/{})",
                    user, attempt, MAX_UPDATE_ATTEMPTS);
        }
        log.warn("Statistics for {} kept changing, recomputing", user);
        return recompute(user, filter, history);
    }

    public Statistics recompute(String user, StatisticsFilter filter,
                                Supplier<? extends Collection<Hand>> history) {
        Collection<Hand> hands = history.get();
        log.info("Recomputing statistics for {} over {} hands", user, hands.size());
        Statistics statistics = aggregator.compute(user, hands, filter);
        store.write(user, filter, statistics.getGeneration(), statistics.getCounters());
        return statistics;
    }

    private Optional<Statistics> cached(String user, StatisticsFilter filter) {
        Optional<StoredStatistics> stored = store.read(user, filter.fingerprint());
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        try {
            StoredStatistics s = stored.get();
            return Optional.of(aggregator.snapshot(user, filter, s.getCounters(), s.getGeneration()));
        } catch (HandHistoryException e) {
            log.warn("Discarding cached statistics for {}: {}", user, e.getMessage());
            return Optional.empty();
        }
    }
}
