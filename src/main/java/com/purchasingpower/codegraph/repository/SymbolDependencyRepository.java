package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.SymbolDependency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for symbol-level dependency edges.
 *
 * Traversal expands one frontier per call ({@code ...In} queries) instead of
 * issuing a query per node.
 */
@Repository
public interface SymbolDependencyRepository extends JpaRepository<SymbolDependency, Long> {

    /**
     * Outgoing edges of a set of symbols.
     */
    List<SymbolDependency> findByFromSymbolIdIn(Collection<Long> fromSymbolIds);

    List<SymbolDependency> findByFromSymbolIdInAndDependencyTypeIn(
        Collection<Long> fromSymbolIds,
        Collection<DependencyType> types
    );

    /**
     * Incoming edges of a set of symbols.
     */
    List<SymbolDependency> findByToSymbolIdIn(Collection<Long> toSymbolIds);

    List<SymbolDependency> findByToSymbolIdInAndDependencyTypeIn(
        Collection<Long> toSymbolIds,
        Collection<DependencyType> types
    );

    /**
     * Incoming edges carrying call-site argument context, for grouping by invocation pattern.
     */
    List<SymbolDependency> findByToSymbolIdAndParameterContextIsNotNullOrderByIdAsc(Long toSymbolId);

    /**
     * Edges of a repository known only by qualified name.
     */
    @Query("""
        SELECT d FROM SymbolDependency d
        WHERE d.toSymbolId IS NULL
          AND d.toQualifiedName IS NOT NULL
          AND d.fromSymbolId IN (
              SELECT s.id FROM CodeSymbol s
              WHERE s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId))
        ORDER BY d.id
        """)
    List<SymbolDependency> findUnresolvedByRepoId(@Param("repoId") Long repoId);

    /**
     * Edges of a repository with neither a bound target nor a qualified name.
     */
    @Query("""
        SELECT d.id FROM SymbolDependency d
        WHERE d.toSymbolId IS NULL
          AND d.toQualifiedName IS NULL
          AND d.fromSymbolId IN (
              SELECT s.id FROM CodeSymbol s
              WHERE s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId))
        """)
    List<Long> findTargetlessIdsByRepoId(@Param("repoId") Long repoId);

    /**
     * Unresolved edges of a repository whose qualified name matches no symbol of
     * that repository, excluding one dependency kind.
     */
    @Query("""
        SELECT d.id FROM SymbolDependency d
        WHERE d.toSymbolId IS NULL
          AND d.toQualifiedName IS NOT NULL
          AND d.dependencyType <> :keptType
          AND d.fromSymbolId IN (
              SELECT s.id FROM CodeSymbol s
              WHERE s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId))
          AND NOT EXISTS (
              SELECT 1 FROM CodeSymbol t
              WHERE t.qualifiedName = d.toQualifiedName
                AND t.fileId IN (SELECT f2.id FROM SourceFile f2 WHERE f2.repoId = :repoId))
        """)
    List<Long> findUnmatchedIdsByRepoId(
        @Param("repoId") Long repoId,
        @Param("keptType") DependencyType keptType
    );

    @Query("""
        SELECT COUNT(d) FROM SymbolDependency d
        WHERE d.fromSymbolId IN (
            SELECT s.id FROM CodeSymbol s
            WHERE s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId))
        """)
    long countByRepoId(@Param("repoId") Long repoId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SymbolDependency d WHERE d.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);

    /**
     * Detach edges that point at the given symbols from other symbols, keeping
     * their qualified name so a later resolution pass can bind them again.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SymbolDependency d SET d.toSymbolId = NULL
        WHERE d.toSymbolId IN :symbolIds
          AND d.fromSymbolId NOT IN :symbolIds
          AND d.toQualifiedName IS NOT NULL
        """)
    int unbindIncoming(@Param("symbolIds") Collection<Long> symbolIds);

    /**
     * Delete every edge that starts or ends at one of the given symbols.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SymbolDependency d WHERE d.fromSymbolId IN :symbolIds OR d.toSymbolId IN :symbolIds")
    int deleteTouchingSymbols(@Param("symbolIds") Collection<Long> symbolIds);
}
