package com.purchasingpower.codegraph.service.graph;

import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.sync.IngestionCounts;

import java.util.List;

/**
 * Persists parser output into the entity store.
 *
 * Writes run in the order files, symbols, hierarchy links, symbol
 * dependencies, file dependencies. Symbols and edges are deduplicated
 * before insertion and merged into rows already stored under the same key,
 * so ingesting the same batch twice leaves the store unchanged.
 */
public interface GraphIngestionService {

    /**
     * Ingest parsed files of one repository.
     *
     * @param repoId      id of a tracked repository
     * @param parsedFiles parser output; paths relative to the repository root
     * @return row counts of the ingestion
     * @throws com.purchasingpower.codegraph.exception.RepositoryNotFoundException if the repository is unknown
     */
    IngestionCounts ingest(Long repoId, List<ParsedFile> parsedFiles);
}
