package com.poker.tracker.persistence;

import com.poker.tracker.BaseIntegrationTest;
import com.poker.tracker.model.Platform;
import com.poker.tracker.validation.HandKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JpaHandRegistry")
class JpaHandRegistryTest extends BaseIntegrationTest {

    @Autowired
    private JpaHandRegistry registry;

    @Autowired
    private ImportedHandRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("1. A hand registers once per user")
    void registersOnce() {
        // Given
        HandKey key = new HandKey("alice", Platform.POKERSTARS, "230000000001");

        // When / Then
        assertThat(registry.register(key)).isTrue();
        assertThat(registry.register(key)).isFalse();
        assertThat(registry.contains(key)).isTrue();
        assertThat(repository.countByUserId("alice")).isEqualTo(1);
    }

    @Test
    @DisplayName("2. Same hand id on another platform or for another user is distinct")
    void distinctKeys() {
        // Given
        registry.register(new HandKey("alice", Platform.POKERSTARS, "555"));

        // When / Then
        assertThat(registry.register(new HandKey("alice", Platform.GGPOKER, "555"))).isTrue();
        assertThat(registry.register(new HandKey("bob", Platform.POKERSTARS, "555"))).isTrue();
        assertThat(registry.contains(new HandKey("carol", Platform.POKERSTARS, "555"))).isFalse();
    }
}
