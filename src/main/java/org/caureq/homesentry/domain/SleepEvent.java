package org.caureq.homesentry.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Observation held back by quiet hours, waiting for the morning digest. */
@Entity
@Table(name = "sleep_events", indexes = {
        @Index(name = "idx_sleep_created", columnList = "created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SleepEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String eventKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Category category;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private Status prevStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Status newStatus;

    @Column(length = 512)
    private String message;

    @Column(columnDefinition = "text")
    private String details; // JSON

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
