package org.caureq.homesentry.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "observation_samples", indexes = {
        @Index(name = "idx_sample_ts", columnList = "ts DESC"),
        @Index(name = "idx_sample_cat_name", columnList = "category, name")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ObservationSample {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Category category;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Status status;

    @Column(columnDefinition = "text")
    private String details; // JSON

    @Column(nullable = false)
    private Instant ts;
}
