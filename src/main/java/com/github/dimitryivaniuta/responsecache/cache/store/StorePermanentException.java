package com.github.dimitryivaniuta.responsecache.cache.store;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;

/**
 * The backing store is unreachable or failing. Lookups degrade to a miss, writes are skipped.
 */
public class StorePermanentException extends ResponseCacheException {

    public StorePermanentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "store";
    }
}
