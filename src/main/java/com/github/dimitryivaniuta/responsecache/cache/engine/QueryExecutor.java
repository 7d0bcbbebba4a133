package com.github.dimitryivaniuta.responsecache.cache.engine;

import java.util.concurrent.CompletableFuture;

/**
 * The execution engine behind the cache: resolves the operation and reports the hints it visited.
 */
@FunctionalInterface
public interface QueryExecutor {

    CompletableFuture<ExecutionResult> execute(QueryRequest request);

    /**
     * Planning step: determines the operation kind before anything is resolved.
     */
    default OperationType plan(String documentText) {
        return OperationType.QUERY;
    }
}
