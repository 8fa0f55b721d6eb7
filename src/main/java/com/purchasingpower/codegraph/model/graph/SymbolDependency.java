package com.purchasingpower.codegraph.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for a directed edge between two symbols.
 *
 * At most one row exists per (from_symbol_id, to_symbol_id, dependency_type, line_number).
 * An edge whose target is known only as {@code toQualifiedName} has a null
 * {@code toSymbolId} until the resolution pass binds it.
 */
@Entity
@Table(name = "dependencies",
        uniqueConstraints = @UniqueConstraint(name = "uq_dependencies_edge",
                columnNames = {"from_symbol_id", "to_symbol_id", "dependency_type", "line_number"}),
        indexes = {
                @Index(name = "idx_dependencies_from", columnList = "from_symbol_id"),
                @Index(name = "idx_dependencies_to", columnList = "to_symbol_id"),
                @Index(name = "idx_dependencies_to_qualified_name", columnList = "to_qualified_name")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SymbolDependency {

    public static final int MAX_QUALIFIED_NAME_LENGTH = 1000;
    public static final int MAX_SHORT_CONTEXT_LENGTH = 500;
    public static final int MAX_CONTEXT_LENGTH = 1000;
    public static final int MAX_PARAMETER_LENGTH = 2000;
    public static final int MAX_CALL_INSTANCE_ID_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_symbol_id", nullable = false)
    private Long fromSymbolId;

    @Column(name = "to_symbol_id")
    private Long toSymbolId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dependency_type", nullable = false, length = 32)
    private DependencyType dependencyType;

    @Column(name = "line_number")
    private Integer lineNumber;

    @Column(name = "to_qualified_name", length = MAX_QUALIFIED_NAME_LENGTH)
    private String toQualifiedName;

    // Call-site context reported by the parser
    @Column(name = "calling_object", length = MAX_SHORT_CONTEXT_LENGTH)
    private String callingObject;

    @Column(name = "resolved_class", length = MAX_SHORT_CONTEXT_LENGTH)
    private String resolvedClass;

    @Column(name = "qualified_context", length = MAX_CONTEXT_LENGTH)
    private String qualifiedContext;

    @Column(name = "method_signature", length = MAX_CONTEXT_LENGTH)
    private String methodSignature;

    @Column(name = "file_context", length = MAX_CONTEXT_LENGTH)
    private String fileContext;

    @Column(name = "namespace_context", length = MAX_SHORT_CONTEXT_LENGTH)
    private String namespaceContext;

    @Column(name = "parameter_context", length = MAX_PARAMETER_LENGTH)
    private String parameterContext;

    /** JSON array of argument type names. */
    @Column(name = "parameter_types", length = MAX_PARAMETER_LENGTH)
    private String parameterTypes;

    @Column(name = "call_instance_id", length = MAX_CALL_INSTANCE_ID_LENGTH)
    private String callInstanceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Returns true if the edge names a target that has not been bound yet.
     */
    public boolean isUnresolved() {
        return toSymbolId == null && toQualifiedName != null;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
