package com.purchasingpower.codegraph.service.sync;

import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.sync.ChangeSet;

import java.util.List;

/**
 * Computes the minimal set of files an incremental run has to touch.
 * Detection is read-only; deleting and re-ingesting is left to the caller.
 */
public interface ChangeDetectionService {

    /**
     * Discovers the files currently on disk and compares them with the stored state.
     *
     * @throws com.purchasingpower.codegraph.exception.ChangeDetectionException if the tree
     *         cannot be walked or a file's modification time cannot be read
     */
    ChangeSet detectChanges(TrackedRepository repository);

    /**
     * Compares an already discovered file list with the stored state.
     *
     * <p>Without a previous run every path is new. Otherwise a stored path missing from
     * the list is deleted, a listed path not stored is new, and a path in both is changed
     * when its modification time is after {@code lastIndexed}. A file that disappears
     * while being checked is skipped; any other I/O failure aborts detection.
     *
     * @param repository      repository with its last-indexed baseline
     * @param discoveredPaths paths relative to the repository root
     */
    ChangeSet detectChanges(TrackedRepository repository, List<String> discoveredPaths);
}
