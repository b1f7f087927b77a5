package org.caureq.homesentry.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only state-change log. The row with the highest id for a key is its current state.
 */
@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_event_key_id", columnList = "event_key, id DESC"),
        @Index(name = "idx_event_created", columnList = "created_at DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EventRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_key", nullable = false, length = 255)
    private String eventKey;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private Status prevStatus; // null on first detection

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Status newStatus;

    @Column(nullable = false, length = 512)
    private String message;

    @Column(nullable = false)
    private boolean notified;

    private Instant notifiedAt;

    @Column(nullable = false)
    private boolean maintenanceSuppressed;

    @Column(nullable = false)
    private boolean sleepSuppressed;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
