package com.purchasingpower.codegraph.model.sync;

import lombok.Builder;
import lombok.Data;

/**
 * Result of an analysis run over one repository.
 *
 * Contains statistics about what was done:
 * - How many files were parsed, changed and deleted
 * - Row counts of the ingestion and resolution passes
 * - Timing information
 */
@Data
@Builder
public class AnalysisResult {

    private final SyncType syncType;
    private final Long repositoryId;
    private final String repositoryName;
    private final int filesAnalyzed;
    private final int filesChanged;
    private final int filesDeleted;
    private final IngestionCounts ingestion;
    private final int unresolvedDeduplicated;
    private final int dependenciesResolved;
    private final int orphansRemoved;
    private final long totalTimeMs;
    private final String errorMessage;

    /**
     * Human-readable summary of the run.
     */
    public String summary() {
        return String.format(
                "[%s] %d files analyzed (%d changed, %d deleted), %d resolved, %d orphans removed in %dms",
                syncType, filesAnalyzed, filesChanged, filesDeleted,
                dependenciesResolved, orphansRemoved, totalTimeMs
        );
    }

    /**
     * Returns true if the graph was modified.
     */
    public boolean hadChanges() {
        return filesAnalyzed > 0 || filesDeleted > 0;
    }

    public boolean isSuccess() {
        return syncType != SyncType.ERROR;
    }
}
