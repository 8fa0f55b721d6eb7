package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.exception.GraphQueryTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs graph store work on the traversal pool, bounded by {@code app.traversal.query-timeout}.
 *
 * <p>When the bound passes the caller stops waiting and the worker is interrupted.
 * The work runs in a transaction carrying the same timeout, so a store call still
 * in flight is aborted by the driver, and work that notices the interrupt is rolled
 * back rather than committed.
 */
@Slf4j
@Component
class GraphQueryRunner {

    private final AsyncTaskExecutor queryExecutor;
    private final PlatformTransactionManager transactionManager;
    private final AppProperties appProperties;

    GraphQueryRunner(@Qualifier("traversalExecutor") AsyncTaskExecutor queryExecutor,
                     PlatformTransactionManager transactionManager,
                     AppProperties appProperties) {
        this.queryExecutor = queryExecutor;
        this.transactionManager = transactionManager;
        this.appProperties = appProperties;
    }

    /**
     * @throws GraphQueryTimeoutException if the work does not finish within the bound
     */
    <T> T run(String operation, boolean readOnly, TransactionCallback<T> work) {
        Duration timeout = appProperties.getTraversal().getQueryTimeout();

        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setReadOnly(readOnly);
        template.setTimeout(timeoutSeconds(timeout));

        Future<T> future = queryExecutor.submit(() -> template.execute(status -> {
            T result = work.doInTransaction(status);
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(operation + " was cancelled after " + timeout.toMillis() + "ms");
            }
            return result;
        }));

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GraphQueryTimeoutException(operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(operation + " failed", e.getCause());
        }
    }

    /** Transaction timeouts are whole seconds; round up so the store never gives up first. */
    static int timeoutSeconds(Duration timeout) {
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }
}
