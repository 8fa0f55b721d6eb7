package com.purchasingpower.codegraph.model.sync;

import java.util.List;

/**
 * Result of writing one batch: either the rows were written, or a unique-key
 * conflict was hit and the rows already persisted under the batch's keys were
 * read back instead.
 *
 * @param kind    how the batch was answered
 * @param rows    persisted rows for the batch
 * @param created rows inserted by this batch
 * @param updated existing rows merged by this batch
 * @param <T>     entity type
 */
public record BatchWriteOutcome<T>(Kind kind, List<T> rows, int created, int updated) {

    public enum Kind {
        /** Rows were inserted or merged by this batch. */
        WRITTEN,

        /** Another writer got there first; rows were re-read by key. */
        CONFLICT_RECOVERED
    }

    public static <T> BatchWriteOutcome<T> written(List<T> rows, int created, int updated) {
        return new BatchWriteOutcome<>(Kind.WRITTEN, rows, created, updated);
    }

    public static <T> BatchWriteOutcome<T> conflictRecovered(List<T> rows) {
        return new BatchWriteOutcome<>(Kind.CONFLICT_RECOVERED, rows, 0, 0);
    }

    public boolean isConflictRecovered() {
        return kind == Kind.CONFLICT_RECOVERED;
    }
}
