package com.poker.tracker.persistence;

import com.poker.tracker.model.Platform;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "imported_hand",
        uniqueConstraints = @UniqueConstraint(name = "uk_imported_hand",
                columnNames = {"user_id", "platform", "hand_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportedHandEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 100, nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", length = 20, nullable = false)
    private Platform platform;

    @Column(name = "hand_id", length = 64, nullable = false)
    private String handId;

    @Column(name = "imported_at", nullable = false)
    private LocalDateTime importedAt;
}
