package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for symbols.
 * Repository-scoped lookups go through the owning file's repo_id.
 */
@Repository
public interface CodeSymbolRepository extends JpaRepository<CodeSymbol, Long> {

    /**
     * Symbols of the given files in store order (id ascending).
     */
    List<CodeSymbol> findByFileIdInOrderByIdAsc(Collection<Long> fileIds);

    List<CodeSymbol> findByFileIdOrderByIdAsc(Long fileId);

    @Query("SELECT s.id FROM CodeSymbol s WHERE s.fileId IN :fileIds")
    List<Long> findIdsByFileIdIn(@Param("fileIds") Collection<Long> fileIds);

    /**
     * Symbols of a repository carrying one of the given qualified names.
     */
    @Query("""
        SELECT s FROM CodeSymbol s
        WHERE s.qualifiedName IN :qualifiedNames
          AND s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId)
        ORDER BY s.id
        """)
    List<CodeSymbol> findByRepoIdAndQualifiedNameIn(
        @Param("repoId") Long repoId,
        @Param("qualifiedNames") Collection<String> qualifiedNames
    );

    @Query("""
        SELECT COUNT(s) FROM CodeSymbol s
        WHERE s.fileId IN (SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId)
        """)
    long countByRepoId(@Param("repoId") Long repoId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM CodeSymbol s WHERE s.fileId IN :fileIds")
    int deleteByFileIdIn(@Param("fileIds") Collection<Long> fileIds);
}
