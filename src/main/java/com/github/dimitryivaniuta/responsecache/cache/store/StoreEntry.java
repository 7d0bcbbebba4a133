package com.github.dimitryivaniuta.responsecache.cache.store;

import com.github.dimitryivaniuta.responsecache.cache.hint.CachePolicy;

import java.util.Objects;

/**
 * Immutable snapshot of one cached response.
 *
 * @param payload              serialized response body
 * @param policy               policy the response was computed with
 * @param storedAtEpochSeconds write time, used for Age and freshness
 */
public record StoreEntry(String payload, CachePolicy policy, long storedAtEpochSeconds) {

    public StoreEntry {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
    }

    public long ageAt(long nowEpochSeconds) {
        return Math.max(0, nowEpochSeconds - storedAtEpochSeconds);
    }

    public boolean isFreshAt(long nowEpochSeconds) {
        return ageAt(nowEpochSeconds) < policy.maxAge();
    }
}
