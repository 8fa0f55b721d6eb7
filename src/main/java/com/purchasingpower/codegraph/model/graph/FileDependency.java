package com.purchasingpower.codegraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for a file-level edge derived from symbol edges and imports.
 * A self-edge (from == to) records an external call or an external package import.
 */
@Entity
@Table(name = "file_dependencies",
        uniqueConstraints = @UniqueConstraint(name = "uq_file_dependencies_edge",
                columnNames = {"from_file_id", "to_file_id", "dependency_type"}),
        indexes = {
                @Index(name = "idx_file_dependencies_from", columnList = "from_file_id"),
                @Index(name = "idx_file_dependencies_to", columnList = "to_file_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileDependency {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_file_id", nullable = false)
    private Long fromFileId;

    @Column(name = "to_file_id", nullable = false)
    private Long toFileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dependency_type", nullable = false, length = 32)
    private DependencyType dependencyType;

    @Column(name = "line_number")
    private Integer lineNumber;

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
