package com.purchasingpower.codegraph.util;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.sync.BatchWriteOutcome;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Two-phase batch write: attempt the write; if another writer already
 * persisted rows under the same unique keys, read those rows back instead.
 *
 * Conflicts are recognised by exception type and SQLState only. Every
 * other failure, including other integrity violations, propagates.
 */
public final class ConflictRecovery {

    /** SQLState of a unique-constraint violation (PostgreSQL, H2). */
    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private ConflictRecovery() {
    }

    public static <T> BatchWriteOutcome<T> writeOrRecover(
            Supplier<BatchWriteOutcome<T>> write,
            Supplier<List<T>> readBack,
            CallContext ctx) {
        try {
            return write.get();
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            List<T> persisted = readBack.get();
            ctx.logRecovered("Duplicate key during batch write, using persisted rows",
                    "Recovered rows", persisted.size());
            return BatchWriteOutcome.conflictRecovered(persisted);
        }
    }

    public static boolean isUniqueViolation(Throwable ex) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof DuplicateKeyException) {
                return true;
            }
            if (cause instanceof SQLException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
