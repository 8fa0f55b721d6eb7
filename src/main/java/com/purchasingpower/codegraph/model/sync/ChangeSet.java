package com.purchasingpower.codegraph.model.sync;

import java.util.List;

/**
 * Files that differ between disk and the last indexed state of a repository.
 * The three sets are disjoint.
 *
 * @param newFiles       relative paths on disk that are not stored
 * @param changedFiles   relative paths stored and on disk, modified after the last run
 * @param deletedFileIds ids of stored files that are no longer on disk
 */
public record ChangeSet(
        List<String> newFiles,
        List<String> changedFiles,
        List<Long> deletedFileIds
) {

    public ChangeSet {
        newFiles = List.copyOf(newFiles);
        changedFiles = List.copyOf(changedFiles);
        deletedFileIds = List.copyOf(deletedFileIds);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return newFiles.isEmpty() && changedFiles.isEmpty() && deletedFileIds.isEmpty();
    }

    /**
     * Returns true if any file has to be parsed again.
     */
    public boolean requiresReanalysis() {
        return !newFiles.isEmpty() || !changedFiles.isEmpty();
    }
}
