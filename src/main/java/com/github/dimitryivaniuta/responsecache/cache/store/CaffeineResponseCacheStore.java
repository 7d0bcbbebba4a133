package com.github.dimitryivaniuta.responsecache.cache.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Default in-process store: a size-bounded Caffeine cache with per-entry expiry.
 *
 * Notes:
 * - Each write carries its own TTL (the response's maxAge), so expiry is variable per entry
 *   instead of one expireAfterWrite for the whole cache.
 * - The ticker reads the injected Clock, keeping store expiry and engine freshness on the same timeline.
 * - TTL is clamped to avoid accidental huge values.
 */
@Slf4j
public final class CaffeineResponseCacheStore implements ResponseCacheStore {

    private static final long MIN_TTL_SECONDS = 1;
    private static final long MAX_TTL_SECONDS = 24 * 60 * 60; // 24h safety cap

    private final Cache<String, TimedEntry> cache;

    public CaffeineResponseCacheStore(long maximumSize, Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    @Override
    public CompletableFuture<Optional<StoreEntry>> get(String key) {
        TimedEntry timed = cache.getIfPresent(key);
        return CompletableFuture.completedFuture(Optional.ofNullable(timed).map(TimedEntry::entry));
    }

    @Override
    public CompletableFuture<Void> set(String key, StoreEntry entry, Duration ttl) {
        long seconds = clamp(ttl.toSeconds(), MIN_TTL_SECONDS, MAX_TTL_SECONDS);
        cache.put(key, new TimedEntry(entry, TimeUnit.SECONDS.toNanos(seconds)));
        return CompletableFuture.completedFuture(null);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    /** Drops every entry. */
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public void close() {
        log.debug("Closing response cache store, entries={}", cache.estimatedSize());
        cache.invalidateAll();
        cache.cleanUp();
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        return Math.min(v, max);
    }

    private record TimedEntry(StoreEntry entry, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, TimedEntry> {

        @Override
        public long expireAfterCreate(String key, TimedEntry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, TimedEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, TimedEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
