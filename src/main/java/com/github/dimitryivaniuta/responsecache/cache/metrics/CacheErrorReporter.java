package com.github.dimitryivaniuta.responsecache.cache.metrics;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;

/**
 * Observability sink for failures the engine absorbs. Implementations must not throw.
 */
@FunctionalInterface
public interface CacheErrorReporter {

    void report(ResponseCacheException error);
}
