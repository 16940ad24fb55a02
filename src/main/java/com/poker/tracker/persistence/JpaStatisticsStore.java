package com.poker.tracker.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poker.tracker.stats.AggregateCounters;
import com.poker.tracker.stats.StatisticsFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Keeps counters as JSON in {@code statistics_snapshot}. Incremental writers
 * go through {@link #compareAndWrite}, a single conditional update on the
 * generation, so of two writers that read the same generation only one wins.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaStatisticsStore implements StatisticsStore {

    private final StatisticsSnapshotRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredStatistics> read(String user, String filterFingerprint) {
        Optional<StatisticsSnapshotEntity> entity =
                repository.findById(StatisticsSnapshotEntity.cacheKey(user, filterFingerprint));
        if (entity.isEmpty()) {
            return Optional.empty();
        }
        try {
            StatisticsSnapshotEntity e = entity.get();
            StatisticsFilter filter = objectMapper.readValue(e.getFilterJson(), StatisticsFilter.class);
            AggregateCounters counters = objectMapper.readValue(e.getCountersJson(), AggregateCounters.class);
            return Optional.of(new StoredStatistics(user, filter, e.getGeneration(), counters));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable statistics snapshot for {} / {}: {}", user, filterFingerprint, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    @Transactional
    public void write(String user, StatisticsFilter filter, long generation, AggregateCounters counters) {
        String fingerprint = filter.fingerprint();
        String key = StatisticsSnapshotEntity.cacheKey(user, fingerprint);
        try {
            StatisticsSnapshotEntity entity = repository.findById(key)
                    .orElseGet(() -> StatisticsSnapshotEntity.builder()
                            .cacheKey(key)
                            .userId(user)
                            .filterFingerprint(fingerprint)
                            .build());
            entity.setFilterJson(objectMapper.writeValueAsString(filter));
            entity.setCountersJson(toJson(key, counters));
            entity.setGeneration(generation);
            entity.setHandCount(counters.getOverall().getHands());
            entity.setUpdatedAt(LocalDateTime.now());
            repository.save(entity);
            log.debug("Stored statistics generation {} for {} / {}", generation, user, fingerprint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize statistics for " + key, e);
        }
    }

    @Override
    @Transactional
    public boolean compareAndWrite(String user, StatisticsFilter filter, long expectedGeneration,
                                   long generation, AggregateCounters counters) {
        String fingerprint = filter.fingerprint();
        String key = StatisticsSnapshotEntity.cacheKey(user, fingerprint);
        int updated = repository.updateIfGeneration(key, expectedGeneration, generation,
                toJson(key, counters), counters.getOverall().getHands(), LocalDateTime.now());
        if (updated == 0) {
            log.debug("Statistics for {} / {} are no longer at generation {}", user, fingerprint, expectedGeneration);
            return false;
        }
        log.debug("Stored statistics generation {} for {} / {}", generation, user, fingerprint);
        return true;
    }

    private String toJson(String key, AggregateCounters counters) {
        try {
            return objectMapper.writeValueAsString(counters);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize statistics for " + key, e);
        }
    }

    @Override
    @Transactional
    public void evict(String user) {
        int deleted = repository.deleteByUserId(user);
        log.info("Evicted {} statistics snapshots for {}", deleted, user);
    }
}
