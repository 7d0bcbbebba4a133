package com.github.dimitryivaniuta.responsecache.cache.hint;

import java.util.Objects;

/**
 * Response-wide policy reduced from every hint visited while executing one request.
 *
 * @param maxAge                      seconds; 0 means "do not cache"
 * @param scope                       PRIVATE if any visited field was PRIVATE
 * @param possibleRootFieldsCacheable every visited root field declared a positive maxAge
 */
public record CachePolicy(int maxAge, CacheScope scope, boolean possibleRootFieldsCacheable) {

    private static final CachePolicy UNCACHEABLE = new CachePolicy(0, CacheScope.PUBLIC, false);

    public CachePolicy {
        if (maxAge < 0) {
            throw new IllegalArgumentException("maxAge must be >= 0, got " + maxAge);
        }
        Objects.requireNonNull(scope, "scope must not be null");
    }

    public static CachePolicy uncacheable() {
        return UNCACHEABLE;
    }

    public static CachePolicy of(int maxAge, CacheScope scope) {
        return new CachePolicy(maxAge, scope, maxAge > 0);
    }

    public boolean isCacheable() {
        return maxAge > 0;
    }
}
