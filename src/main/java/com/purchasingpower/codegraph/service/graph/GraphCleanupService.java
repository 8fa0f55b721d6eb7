package com.purchasingpower.codegraph.service.graph;

import java.util.Collection;

/**
 * Removes graph data. Edges reference symbols and files by id only, so every
 * delete removes the dependent rows first: symbol edges, file edges, symbols,
 * then files.
 */
public interface GraphCleanupService {

    /**
     * Deletes files together with their symbols and every edge touching them.
     *
     * @throws IllegalArgumentException if an id is null or not positive
     * @return number of deleted file rows
     */
    int deleteFiles(Collection<Long> fileIds);

    /**
     * Deletes the symbols and edges of files but keeps the file rows, ahead of re-ingestion.
     * Edges from other files into these files lose their target but keep their qualified
     * name, so the next resolution pass binds them to the re-ingested symbols.
     */
    void cleanupFileData(Collection<Long> fileIds);

    /**
     * Deletes all graph data of a repository; the repository row stays.
     */
    void cleanupRepository(Long repoId);

    /**
     * Deletes a repository and all of its graph data.
     *
     * @return false if no repository has that name
     */
    boolean deleteRepositoryByName(String name);
}
