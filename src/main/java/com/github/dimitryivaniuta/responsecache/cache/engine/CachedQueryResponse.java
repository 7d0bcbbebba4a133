package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.github.dimitryivaniuta.responsecache.cache.http.HttpCacheHeaders;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBucket;

/**
 * What the transport sends back: the body plus freshness headers.
 *
 * @param servedFrom bucket the body was read from; {@code null} unless {@code cacheHit}
 */
public record CachedQueryResponse(String body, HttpCacheHeaders headers, boolean cacheHit, CacheKeyBucket servedFrom) {

    public static CachedQueryResponse hit(String body, HttpCacheHeaders headers, CacheKeyBucket bucket) {
        return new CachedQueryResponse(body, headers, true, bucket);
    }

    public static CachedQueryResponse executed(String body, HttpCacheHeaders headers) {
        return new CachedQueryResponse(body, headers, false, null);
    }
}
