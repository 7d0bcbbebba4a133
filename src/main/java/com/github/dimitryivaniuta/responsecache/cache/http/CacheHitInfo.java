package com.github.dimitryivaniuta.responsecache.cache.http;

/**
 * Whether the response came from the store and, if so, how old the entry is.
 */
public record CacheHitInfo(boolean hit, long ageSeconds) {

    private static final CacheHitInfo MISS = new CacheHitInfo(false, 0);

    public static CacheHitInfo miss() {
        return MISS;
    }

    public static CacheHitInfo hit(long ageSeconds) {
        return new CacheHitInfo(true, Math.max(0, ageSeconds));
    }
}
