package com.poker.tracker.persistence;

import com.poker.tracker.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ImportedHandRepository extends JpaRepository<ImportedHandEntity, Long> {

    boolean existsByUserIdAndPlatformAndHandId(String userId, Platform platform, String handId);

    long countByUserId(String userId);
}
