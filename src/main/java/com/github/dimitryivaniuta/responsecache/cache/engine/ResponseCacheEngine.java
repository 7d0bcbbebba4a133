package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHintAggregator;
import com.github.dimitryivaniuta.responsecache.cache.hint.CachePolicy;
import com.github.dimitryivaniuta.responsecache.cache.http.CacheHeaderTranslator;
import com.github.dimitryivaniuta.responsecache.cache.http.CacheHitInfo;
import com.github.dimitryivaniuta.responsecache.cache.http.HttpCacheHeaders;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBucket;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.responsecache.cache.key.KeyDerivationException;
import com.github.dimitryivaniuta.responsecache.cache.metrics.CacheErrorReporter;
import com.github.dimitryivaniuta.responsecache.cache.metrics.ResponseCacheMetrics;
import com.github.dimitryivaniuta.responsecache.cache.policy.PolicyGate;
import com.github.dimitryivaniuta.responsecache.cache.store.ResponseCacheStore;
import com.github.dimitryivaniuta.responsecache.cache.store.StoreEntry;
import com.github.dimitryivaniuta.responsecache.cache.store.StorePermanentException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Full-response cache around a {@link QueryExecutor}.
 *
 * <p>Two hook points, usable separately by an execution engine that drives its own lifecycle:
 * <ol>
 *   <li>{@link #lookup(CacheRequestContext)}: after planning, before resolution. A present
 *       result short-circuits execution.</li>
 *   <li>{@link #afterExecution(CacheRequestContext, ExecutionResult)}: after the response is
 *       assembled. Aggregates hints, stores the response when allowed, computes headers.</li>
 * </ol>
 * {@link #execute(QueryRequest, QueryExecutor)} runs both around an executor.
 *
 * <p>Caching is best-effort: store, key and predicate failures are reported and the request
 * continues without the cache. Failures of the executor itself propagate unchanged.
 *
 * <p>Holds no per-request state; one instance serves all concurrent requests.
 */
@Slf4j
public final class ResponseCacheEngine {

    private final ResponseCacheStore store;
    private final CacheKeyBuilder keyBuilder;
    private final CacheHintAggregator aggregator;
    private final CacheHeaderTranslator headerTranslator;
    private final PolicyGate<QueryRequest> policyGate;
    private final ResponseCacheOptions options;
    private final ResponseCacheMetrics metrics;
    private final CacheErrorReporter errorReporter;
    private final Clock clock;

    public ResponseCacheEngine(ResponseCacheStore store,
                               CacheKeyBuilder keyBuilder,
                               CacheHintAggregator aggregator,
                               CacheHeaderTranslator headerTranslator,
                               ResponseCacheOptions options,
                               ResponseCacheMetrics metrics,
                               CacheErrorReporter errorReporter,
                               Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.keyBuilder = Objects.requireNonNull(keyBuilder, "keyBuilder must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.headerTranslator = Objects.requireNonNull(headerTranslator, "headerTranslator must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.policyGate = new PolicyGate<>(options.getShouldReadFromCache(), options.getShouldWriteToCache());
    }

    public CompletableFuture<CachedQueryResponse> execute(QueryRequest request, QueryExecutor executor) {
        CacheRequestContext ctx = newContext(request);
        return lookup(ctx).thenCompose(cached -> {
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
            return executor.execute(request).thenCompose(result -> afterExecution(ctx, result));
        });
    }

    /**
     * Resolves session and extra key data once per request.
     */
    public CacheRequestContext newContext(QueryRequest request) {
        String sessionId = null;
        String extraData = null;
        KeyDerivationException failure = null;
        try {
            sessionId = options.getSessionId().apply(request);
            extraData = options.getExtraCacheKeyData().apply(request);
        } catch (RuntimeException ex) {
            failure = new KeyDerivationException("Unable to resolve session id / extra cache key data", ex);
            report(failure);
        }
        return new CacheRequestContext(request, sessionId, extraData, failure);
    }

    /**
     * Pre-execution hook. Completes with the cached response on a hit, empty otherwise.
     * Never completes exceptionally.
     */
    public CompletableFuture<Optional<CachedQueryResponse>> lookup(CacheRequestContext ctx) {
        if (!participates(ctx)) {
            ctx.transition(CacheRequestState.MISS_EXECUTING);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        ctx.transition(CacheRequestState.CHECKING_READ_POLICY);
        return policyGate.mayRead(ctx.getRequest(), this::report).thenCompose(allowed -> {
            if (!allowed) {
                log.debug("Cache read denied by policy");
                metrics.cacheMiss();
                ctx.transition(CacheRequestState.MISS_EXECUTING);
                return CompletableFuture.completedFuture(Optional.<CachedQueryResponse>empty());
            }

            ctx.transition(CacheRequestState.LOOKUP);
            long start = System.nanoTime();
            return probe(ctx, keyBuilder.candidateBuckets(ctx.hasSession()), 0)
                    .thenApply(found -> {
                        metrics.recordLookup(System.nanoTime() - start);
                        if (found.isEmpty()) {
                            metrics.cacheMiss();
                            ctx.transition(CacheRequestState.MISS_EXECUTING);
                            return Optional.<CachedQueryResponse>empty();
                        }
                        return Optional.of(respondFromCache(ctx, found.get()));
                    });
        });
    }

    /**
     * Post-execution hook: aggregates hints, writes the response when allowed and computes headers.
     * Never completes exceptionally.
     */
    public CompletableFuture<CachedQueryResponse> afterExecution(CacheRequestContext ctx, ExecutionResult result) {
        ctx.transition(CacheRequestState.AGGREGATING);
        CachePolicy policy = aggregator.aggregate(result.hints());
        ctx.policy(policy);

        HttpCacheHeaders headers = result.hasErrors()
                ? HttpCacheHeaders.none()
                : headerTranslator.computeHeaders(policy, CacheHitInfo.miss());

        return maybeWrite(ctx, result, policy)
                .handle((ignored, ex) -> {
                    if (ex != null) {
                        // maybeWrite absorbs its own failures; anything left here is a programming error
                        log.error("Unexpected failure while writing response cache entry", unwrap(ex));
                        ctx.transition(CacheRequestState.SKIPPED);
                    }
                    ctx.transition(CacheRequestState.RESPONDING);
                    ctx.transition(CacheRequestState.END);
                    return CachedQueryResponse.executed(result.body(), headers);
                });
    }

    private CompletableFuture<Optional<Match>> probe(CacheRequestContext ctx, List<CacheKeyBucket> buckets, int index) {
        if (index >= buckets.size()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CacheKeyBucket bucket = buckets.get(index);

        final String key;
        try {
            key = keyBuilder.buildKey(ctx.keyComponents(), bucket);
        } catch (KeyDerivationException ex) {
            ctx.keyDerivationFailed();
            report(ex);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return safeStoreCall(() -> store.get(key), "get")
                .thenApply(entry -> entry.flatMap(e -> freshEntry(e, key)))
                .exceptionally(ex -> {
                    report(asStoreError(ex, "get"));
                    return Optional.empty();
                })
                .thenCompose(found -> {
                    if (found.isPresent()) {
                        return CompletableFuture.completedFuture(Optional.of(new Match(bucket, found.get())));
                    }
                    return probe(ctx, buckets, index + 1);
                });
    }

    private Optional<StoreEntry> freshEntry(StoreEntry entry, String key) {
        if (entry.isFreshAt(nowEpochSeconds())) {
            return Optional.of(entry);
        }
        log.debug("Ignoring expired response cache entry key={}", key);
        return Optional.empty();
    }

    private CachedQueryResponse respondFromCache(CacheRequestContext ctx, Match match) {
        ctx.transition(CacheRequestState.HIT);
        ctx.matched(match.bucket());
        ctx.policy(match.entry().policy());

        long age = match.entry().ageAt(nowEpochSeconds());
        HttpCacheHeaders headers = headerTranslator.computeHeaders(match.entry().policy(), CacheHitInfo.hit(age));
        metrics.cacheHit(match.bucket().tag());
        log.debug("Response cache hit bucket={}, age={}s", match.bucket().tag(), age);

        ctx.transition(CacheRequestState.RESPONDING);
        ctx.transition(CacheRequestState.END);
        return CachedQueryResponse.hit(match.entry().payload(), headers, match.bucket());
    }

    private CompletableFuture<Void> maybeWrite(CacheRequestContext ctx, ExecutionResult result, CachePolicy policy) {
        if (!participates(ctx)) {
            return skip(ctx, notParticipatingReason(ctx));
        }
        if (result.hasErrors()) {
            return skip(ctx, "errors");
        }
        if (!result.hasBody()) {
            return skip(ctx, "no_body");
        }
        if (ctx.isKeyDerivationFailed()) {
            // already reported during lookup
            return skip(ctx, "key_derivation");
        }

        ctx.transition(CacheRequestState.CHECKING_WRITE_POLICY);
        return policyGate.mayWrite(ctx.getRequest(), this::report).thenCompose(allowed -> {
            if (!allowed) {
                log.debug("Cache write denied by policy");
                return skip(ctx, "write_denied");
            }
            if (!policy.isCacheable()) {
                log.debug("Response not cacheable (maxAge=0, possibleRootFieldsCacheable={})",
                        policy.possibleRootFieldsCacheable());
                return skip(ctx, "uncacheable");
            }

            Optional<CacheKeyBucket> target = keyBuilder.writeBucket(policy.scope(), ctx.hasSession());
            if (target.isEmpty()) {
                return skip(ctx, "private_without_session");
            }
            CacheKeyBucket bucket = target.get();

            final String key;
            try {
                key = keyBuilder.buildKey(ctx.keyComponents(), bucket);
            } catch (KeyDerivationException ex) {
                ctx.keyDerivationFailed();
                report(ex);
                return skip(ctx, "key_derivation");
            }

            ctx.transition(CacheRequestState.WRITING);
            StoreEntry entry = new StoreEntry(result.body(), policy, nowEpochSeconds());
            return safeStoreCall(() -> store.set(key, entry, Duration.ofSeconds(policy.maxAge())), "set")
                    .<Void>handle((ignored, ex) -> {
                        if (ex != null) {
                            report(asStoreError(ex, "set"));
                            metrics.writeSkipped("store_error");
                            return null;
                        }
                        ctx.written(bucket);
                        metrics.cacheWrite(bucket.tag());
                        log.debug("Response cached bucket={}, maxAge={}s, scope={}",
                                bucket.tag(), policy.maxAge(), policy.scope());
                        return null;
                    });
        });
    }

    private boolean participates(CacheRequestContext ctx) {
        return options.isEnabled() && ctx.getRequest().isQuery() && ctx.getSetupFailure() == null;
    }

    private String notParticipatingReason(CacheRequestContext ctx) {
        if (!ctx.getRequest().isQuery()) return "not_query";
        if (ctx.getSetupFailure() != null) return "key_derivation";
        return "disabled";
    }

    private CompletableFuture<Void> skip(CacheRequestContext ctx, String reason) {
        ctx.transition(CacheRequestState.SKIPPED);
        metrics.writeSkipped(reason);
        return CompletableFuture.completedFuture(null);
    }

    private static <T> CompletableFuture<T> safeStoreCall(Supplier<CompletableFuture<T>> call, String operation) {
        try {
            CompletableFuture<T> f = call.get();
            return (f != null) ? f : CompletableFuture.failedFuture(
                    new StorePermanentException("Store " + operation + " returned no future", null));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static StorePermanentException asStoreError(Throwable ex, String operation) {
        Throwable cause = unwrap(ex);
        if (cause instanceof StorePermanentException spe) {
            return spe;
        }
        return new StorePermanentException("Response cache store " + operation + " failed: " + cause.getMessage(), cause);
    }

    private static Throwable unwrap(Throwable ex) {
        return (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
    }

    private void report(ResponseCacheException error) {
        try {
            errorReporter.report(error);
        } catch (RuntimeException reporterEx) {
            log.warn("Response cache error reporter failed: {}", reporterEx.toString());
        }
    }

    private long nowEpochSeconds() {
        return clock.instant().getEpochSecond();
    }

    private record Match(CacheKeyBucket bucket, StoreEntry entry) {}
}
