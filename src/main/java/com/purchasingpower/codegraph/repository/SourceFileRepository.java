package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.graph.SourceFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA Repository for source files, addressed by (repository, path).
 */
@Repository
public interface SourceFileRepository extends JpaRepository<SourceFile, Long> {

    Optional<SourceFile> findByRepoIdAndPath(Long repoId, String path);

    List<SourceFile> findByRepoId(Long repoId);

    List<SourceFile> findByRepoIdAndPathIn(Long repoId, Collection<String> paths);

    @Query("SELECT f.id FROM SourceFile f WHERE f.repoId = :repoId")
    List<Long> findIdsByRepoId(@Param("repoId") Long repoId);

    long countByRepoId(Long repoId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SourceFile f WHERE f.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
