package com.github.dimitryivaniuta.responsecache.cache.hint;

/**
 * Per-field cache annotation attached by the execution engine.
 *
 * @param maxAge seconds the field value may be reused; {@code null} means the field carries no hint
 * @param scope  visibility; {@code null} is treated as PUBLIC
 */
public record CacheHint(Integer maxAge, CacheScope scope) {

    public CacheHint {
        if (maxAge != null && maxAge < 0) {
            throw new IllegalArgumentException("maxAge must be >= 0, got " + maxAge);
        }
    }

    public static CacheHint none() {
        return new CacheHint(null, null);
    }

    public static CacheHint publicFor(int maxAge) {
        return new CacheHint(maxAge, CacheScope.PUBLIC);
    }

    public static CacheHint privateFor(int maxAge) {
        return new CacheHint(maxAge, CacheScope.PRIVATE);
    }

    public boolean hasMaxAge() {
        return maxAge != null;
    }

    public boolean isPrivate() {
        return scope == CacheScope.PRIVATE;
    }
}
