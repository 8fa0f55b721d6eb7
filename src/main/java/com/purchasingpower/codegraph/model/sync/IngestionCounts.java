package com.purchasingpower.codegraph.model.sync;

import lombok.Data;

/**
 * Row counts reported by one ingestion call.
 */
@Data
public class IngestionCounts {

    private int filesCreated;
    private int filesUpdated;
    private int symbolsCreated;
    private int symbolsUpdated;
    private int symbolsDeduplicated;
    private int hierarchyLinks;
    private int dependenciesCreated;
    private int dependenciesUpdated;
    private int dependenciesDeduplicated;
    private int fileDependenciesCreated;
    private int fileDependenciesUpdated;
    private int fileDependenciesDeduplicated;
    private int conflictsRecovered;
    private int recordsSkipped;

    public void addRecordsSkipped(int count) {
        recordsSkipped += count;
    }

    public String summary() {
        return String.format(
                "files +%d/~%d, symbols +%d/~%d (-%d dup), deps +%d/~%d (-%d dup), file deps +%d/~%d (-%d dup), %d conflicts recovered, %d skipped",
                filesCreated, filesUpdated,
                symbolsCreated, symbolsUpdated, symbolsDeduplicated,
                dependenciesCreated, dependenciesUpdated, dependenciesDeduplicated,
                fileDependenciesCreated, fileDependenciesUpdated, fileDependenciesDeduplicated,
                conflictsRecovered, recordsSkipped);
    }
}
