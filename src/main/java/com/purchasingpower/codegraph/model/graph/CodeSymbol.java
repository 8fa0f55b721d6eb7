package com.purchasingpower.codegraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for a named code entity owned by one file.
 *
 * Physical identity is (file, name, kind, start line). The containment tree
 * is held as a plain {@code parent_symbol_id} column; parents are looked up
 * by id, never navigated as an object graph.
 */
@Entity
@Table(name = "symbols", indexes = {
        @Index(name = "idx_symbols_file", columnList = "file_id"),
        @Index(name = "idx_symbols_name", columnList = "name"),
        @Index(name = "idx_symbols_qualified_name", columnList = "qualified_name"),
        @Index(name = "idx_symbols_parent", columnList = "parent_symbol_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeSymbol {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_id", nullable = false)
    private Long fileId;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Column(name = "qualified_name", length = 1000)
    private String qualifiedName;

    @Column(name = "parent_symbol_id")
    private Long parentSymbolId;

    @Enumerated(EnumType.STRING)
    @Column(name = "symbol_type", nullable = false, length = 32)
    private SymbolType symbolType;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", length = 16)
    private Visibility visibility;

    @Column(name = "start_line")
    private Integer startLine;

    @Column(name = "end_line")
    private Integer endLine;

    @Column(name = "is_exported", nullable = false)
    private boolean exported;

    @Column(name = "signature", length = 4000)
    private String signature;

    @Column(name = "description", length = 4000)
    private String description;

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
