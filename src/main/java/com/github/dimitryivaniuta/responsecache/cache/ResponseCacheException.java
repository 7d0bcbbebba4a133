package com.github.dimitryivaniuta.responsecache.cache;

/**
 * Base type for failures raised inside the caching layer.
 *
 * <p>None of these ever reach the caller-visible response: the engine reports them and
 * continues without the cache.
 */
public abstract class ResponseCacheException extends RuntimeException {

    protected ResponseCacheException(String message) {
        super(message);
    }

    protected ResponseCacheException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short tag used for metrics and logs. */
    public abstract String errorType();
}
