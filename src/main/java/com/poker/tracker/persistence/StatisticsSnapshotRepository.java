package com.poker.tracker.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface StatisticsSnapshotRepository extends JpaRepository<StatisticsSnapshotEntity, String> {

    @Query("SELECT s FROM StatisticsSnapshotEntity s WHERE s.userId = :userId ORDER BY s.updatedAt DESC")
    List<StatisticsSnapshotEntity> findByUserId(@Param("userId") String userId);

    /**
     * Conditional update of the counters; touches no row when the stored
     * generation is not the expected one.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE StatisticsSnapshotEntity s SET s.countersJson = :countersJson, s.generation = :generation, "
            + "s.handCount = :handCount, s.updatedAt = :updatedAt, s.version = s.version + 1 "
            + "WHERE s.cacheKey = :cacheKey AND s.generation = :expectedGeneration")
    int updateIfGeneration(@Param("cacheKey") String cacheKey,
                           @Param("expectedGeneration") long expectedGeneration,
                           @Param("generation") long generation,
                           @Param("countersJson") String countersJson,
                           @Param("handCount") long handCount,
                           @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Drops every cached snapshot of a user, e.g. after hands were deleted.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM StatisticsSnapshotEntity s WHERE s.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}
