package com.poker.tracker.persistence;

import com.poker.tracker.validation.HandKey;
import com.poker.tracker.validation.HandRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Registry of imported hands backed by {@code imported_hand}. The unique
 * constraint settles races between workers registering the same hand.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaHandRegistry implements HandRegistry {

    private final ImportedHandRepository repository;

    @Override
    public boolean register(HandKey key) {
        if (contains(key)) {
            return false;
        }
        try {
            repository.saveAndFlush(ImportedHandEntity.builder()
                    .userId(key.user())
                    .platform(key.platform())
                    .handId(key.handId())
                    .importedAt(LocalDateTime.now())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Hand {} registered concurrently", key);
            return false;
        }
    }

    @Override
    public boolean contains(HandKey key) {
        return repository.existsByUserIdAndPlatformAndHandId(key.user(), key.platform(), key.handId());
    }
}
