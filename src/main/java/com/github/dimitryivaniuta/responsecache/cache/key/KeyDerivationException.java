package com.github.dimitryivaniuta.responsecache.cache.key;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;

/**
 * A key component could not be canonicalized (typically a variable value Jackson cannot serialize).
 * Caching is abandoned for that request; execution proceeds uncached.
 */
public class KeyDerivationException extends ResponseCacheException {

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "key_derivation";
    }
}
