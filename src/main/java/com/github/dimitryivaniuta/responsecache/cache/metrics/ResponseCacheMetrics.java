package com.github.dimitryivaniuta.responsecache.cache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ResponseCacheMetrics {

    private final MeterRegistry registry;

    public ResponseCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Lookup ----
    public void cacheHit(String bucket) {
        Counter.builder("response_cache_hits_total")
                .tag("bucket", bucket) // anonymous | authenticated | private
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("response_cache_misses_total")
                .register(registry)
                .increment();
    }

    // ---- Write ----
    public void cacheWrite(String bucket) {
        Counter.builder("response_cache_writes_total")
                .tag("bucket", bucket)
                .register(registry)
                .increment();
    }

    public void writeSkipped(String reason) {
        Counter.builder("response_cache_write_skipped_total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // ---- Errors ----
    public void error(String errorType) {
        Counter.builder("response_cache_errors_total")
                .tag("type", errorType) // key_derivation | store | policy_predicate
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordLookup(long nanos) {
        Timer.builder("response_cache_lookup_duration_seconds")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
