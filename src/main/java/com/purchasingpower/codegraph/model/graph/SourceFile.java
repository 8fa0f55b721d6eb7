package com.purchasingpower.codegraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for a source file of a tracked repository.
 * Unique by (repo_id, path); the path is relative to the repository root with '/' separators.
 */
@Entity
@Table(name = "files",
        uniqueConstraints = @UniqueConstraint(name = "uq_files_repo_path", columnNames = {"repo_id", "path"}),
        indexes = {
                @Index(name = "idx_files_repo", columnList = "repo_id"),
                @Index(name = "idx_files_language", columnList = "language")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repo_id", nullable = false)
    private Long repoId;

    @Column(name = "path", nullable = false, length = 1000)
    private String path;

    @Column(name = "language", nullable = false, length = 32)
    private String language;

    @Column(name = "size")
    private Long size;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "last_modified")
    private Instant lastModified;

    @Column(name = "is_generated", nullable = false)
    private boolean generated;

    @Column(name = "is_test", nullable = false)
    private boolean test;

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
