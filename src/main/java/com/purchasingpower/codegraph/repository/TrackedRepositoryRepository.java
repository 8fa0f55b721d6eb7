package com.purchasingpower.codegraph.repository;

import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * JPA Repository for tracked codebase roots.
 */
@Repository
public interface TrackedRepositoryRepository extends JpaRepository<TrackedRepository, Long> {

    /**
     * Find a repository by its absolute root path.
     */
    Optional<TrackedRepository> findByPath(String path);

    /**
     * Find the oldest repository registered under a name.
     */
    Optional<TrackedRepository> findFirstByNameOrderByIdAsc(String name);

    /**
     * Move the incremental-analysis baseline of a repository.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE TrackedRepository r SET r.lastIndexed = :lastIndexed, r.updatedAt = :lastIndexed WHERE r.id = :repoId")
    int updateLastIndexed(@Param("repoId") Long repoId, @Param("lastIndexed") Instant lastIndexed);
}
