package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.model.sync.AnalysisResult;
import com.purchasingpower.codegraph.model.sync.IngestionCounts;
import com.purchasingpower.codegraph.model.sync.SyncType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Analyze repository response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

    private boolean success;
    private SyncType syncType;
    private Long repositoryId;
    private String repositoryName;
    private int filesAnalyzed;
    private int filesChanged;
    private int filesDeleted;
    private IngestionCounts ingestion;
    private int unresolvedDeduplicated;
    private int dependenciesResolved;
    private int orphansRemoved;
    private long totalTimeMs;
    private String summary;
    private String error;

    public static AnalysisResponse from(AnalysisResult result) {
        return AnalysisResponse.builder()
            .success(result.isSuccess())
            .syncType(result.getSyncType())
            .repositoryId(result.getRepositoryId())
            .repositoryName(result.getRepositoryName())
            .filesAnalyzed(result.getFilesAnalyzed())
            .filesChanged(result.getFilesChanged())
            .filesDeleted(result.getFilesDeleted())
            .ingestion(result.getIngestion())
            .unresolvedDeduplicated(result.getUnresolvedDeduplicated())
            .dependenciesResolved(result.getDependenciesResolved())
            .orphansRemoved(result.getOrphansRemoved())
            .totalTimeMs(result.getTotalTimeMs())
            .summary(result.summary())
            .error(result.getErrorMessage())
            .build();
    }

    public static AnalysisResponse error(String error) {
        return AnalysisResponse.builder()
            .success(false)
            .syncType(SyncType.ERROR)
            .error(error)
            .build();
    }
}
