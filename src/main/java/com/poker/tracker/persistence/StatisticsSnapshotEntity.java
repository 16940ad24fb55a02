package com.poker.tracker.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "statistics_snapshot")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsSnapshotEntity {

    // user id and filter fingerprint joined by ':'
    @Id
    @Column(name = "cache_key", length = 200)
    private String cacheKey;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Column(name = "filter_fingerprint", length = 64, nullable = false)
    private String filterFingerprint;

    @Column(name = "filter_json", length = 2000, nullable = false)
    private String filterJson;

    @Column(name = "counters_json", length = 1048576, nullable = false)
    private String countersJson;

    @Column(name = "generation", nullable = false)
    private long generation;

    @Column(name = "hand_count", nullable = false)
    private long handCount;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public static String cacheKey(String userId, String fingerprint) {
        return userId + ":" + fingerprint;
    }
}
