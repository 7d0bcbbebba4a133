package com.github.dimitryivaniuta.responsecache.cache.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Key-value store the engine reads from and writes to.
 *
 * <p>Implementations must provide atomic per-key get/set and isolate keys from each other;
 * the engine never performs read-modify-write on a key. Both operations may complete
 * asynchronously and may fail.
 */
public interface ResponseCacheStore extends AutoCloseable {

    CompletableFuture<Optional<StoreEntry>> get(String key);

    /**
     * Stores the entry for {@code ttl}. A later write to the same key replaces it (last write wins).
     */
    CompletableFuture<Void> set(String key, StoreEntry entry, Duration ttl);

    /** Releases resources; called once at shutdown. */
    @Override
    default void close() {
    }
}
