package com.purchasingpower.codegraph.model.sync;

/**
 * Type of analysis run that was performed.
 */
public enum SyncType {

    /**
     * First time analyzing this repository.
     * Every discovered file was parsed and ingested.
     */
    INITIAL_FULL_INDEX,

    /**
     * User explicitly requested a full re-analysis.
     * All graph data of the repository was removed and rebuilt.
     */
    FORCED_FULL_REINDEX,

    /**
     * Normal incremental run.
     * Only new, changed and deleted files since the last run were processed.
     */
    INCREMENTAL,

    /**
     * Nothing changed on disk since the last run.
     */
    NO_CHANGES,

    /**
     * The run failed; the baseline was left untouched.
     * Check logs for details.
     */
    ERROR
}
