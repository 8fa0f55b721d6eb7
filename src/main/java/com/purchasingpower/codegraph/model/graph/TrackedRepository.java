package com.purchasingpower.codegraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for a tracked codebase root.
 * Maps to table 'repositories'; {@code lastIndexed} is the baseline of incremental analysis.
 */
@Entity
@Table(name = "repositories", indexes = {
        @Index(name = "idx_repositories_name", columnList = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedRepository {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "path", nullable = false, unique = true, length = 1000)
    private String path;

    @Column(name = "last_indexed")
    private Instant lastIndexed;

    @Column(name = "git_hash", length = 64)
    private String gitHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
