package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.graph.FileDependency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for file-level dependency edges.
 */
@Repository
public interface FileDependencyRepository extends JpaRepository<FileDependency, Long> {

    List<FileDependency> findByFromFileIdIn(Collection<Long> fromFileIds);

    List<FileDependency> findByToFileId(Long toFileId);

    /**
     * Delete every file edge that starts or ends at one of the given files.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FileDependency d WHERE d.fromFileId IN :fileIds OR d.toFileId IN :fileIds")
    int deleteTouchingFiles(@Param("fileIds") Collection<Long> fileIds);
}
