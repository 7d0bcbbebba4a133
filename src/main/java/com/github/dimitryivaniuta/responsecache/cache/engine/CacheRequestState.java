package com.github.dimitryivaniuta.responsecache.cache.engine;

/**
 * Lifecycle of one request through the engine.
 *
 * <pre>
 * START -> CHECKING_READ_POLICY -> LOOKUP -> HIT ---------------------------------------> RESPONDING -> END
 *                               \-------------> MISS_EXECUTING -> AGGREGATING
 *                                   -> CHECKING_WRITE_POLICY -> WRITING | SKIPPED -----> RESPONDING -> END
 * </pre>
 * Read-denied requests and non-query operations go straight to MISS_EXECUTING.
 */
public enum CacheRequestState {
    START,
    CHECKING_READ_POLICY,
    LOOKUP,
    HIT,
    MISS_EXECUTING,
    AGGREGATING,
    CHECKING_WRITE_POLICY,
    WRITING,
    SKIPPED,
    RESPONDING,
    END
}
