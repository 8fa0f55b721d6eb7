package com.purchasingpower.codegraph.service.sync;

import com.purchasingpower.codegraph.model.sync.AnalysisResult;

/**
 * Keeps the code graph of a repository in step with its files on disk.
 *
 * The first run over a repository parses every file. Later runs only parse
 * files that are new or modified since the last successful run, and delete
 * the graph data of files that disappeared.
 */
public interface IncrementalAnalysisService {

    /**
     * Analyze a repository, incrementally when it was analyzed before.
     *
     * @param repositoryPath root directory of the codebase
     * @param repositoryName display name; used when the repository is registered
     * @return outcome of the run; failures are reported as {@code SyncType.ERROR}, never thrown
     */
    AnalysisResult analyze(String repositoryPath, String repositoryName);

    /**
     * Drops all graph data of the repository and analyzes it from scratch.
     */
    AnalysisResult forceFullReanalysis(String repositoryPath, String repositoryName);
}
