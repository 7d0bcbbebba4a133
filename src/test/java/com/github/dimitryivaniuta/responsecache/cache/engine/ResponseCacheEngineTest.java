package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHint;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHintAggregator;
import com.github.dimitryivaniuta.responsecache.cache.hint.FieldCacheHint;
import com.github.dimitryivaniuta.responsecache.cache.http.CacheHeaderTranslator;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBucket;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.responsecache.cache.key.KeyDerivationException;
import com.github.dimitryivaniuta.responsecache.cache.metrics.ResponseCacheMetrics;
import com.github.dimitryivaniuta.responsecache.cache.policy.CachePredicate;
import com.github.dimitryivaniuta.responsecache.cache.policy.PolicyPredicateException;
import com.github.dimitryivaniuta.responsecache.cache.store.CaffeineResponseCacheStore;
import com.github.dimitryivaniuta.responsecache.cache.store.ResponseCacheStore;
import com.github.dimitryivaniuta.responsecache.cache.store.StoreEntry;
import com.github.dimitryivaniuta.responsecache.cache.store.StorePermanentException;
import com.github.dimitryivaniuta.responsecache.sample.DemoQueryExecutor;
import com.github.dimitryivaniuta.responsecache.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.dimitryivaniuta.responsecache.cache.engine.CacheRequestState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheEngineTest {

    private static final String BASIC_QUERY = "{ cached }";

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<ResponseCacheException> reported = new CopyOnWriteArrayList<>();
    private final DemoQueryExecutor executor = new DemoQueryExecutor(new ObjectMapper());

    private CaffeineResponseCacheStore store;
    private ResponseCacheEngine engine;

    @BeforeEach
    void setUp() {
        store = new CaffeineResponseCacheStore(1_000, clock);
        engine = engine(store, headerDrivenOptions().build(), true);
    }

    @Test
    void scenarioA_missThenImmediateHit() {
        CachedQueryResponse first = fetch(BASIC_QUERY);
        assertThat(first.cacheHit()).isFalse();
        assertThat(first.body()).isEqualTo("{\"data\":{\"cached\":\"value:cached\"}}");
        assertThat(first.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(first.headers().ageValue()).isEmpty();

        CachedQueryResponse second = fetch(BASIC_QUERY);
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.body()).isEqualTo(first.body());
        assertThat(second.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(second.headers().age()).isZero();

        assertThat(executor.resolverCallCount("cached")).isEqualTo(1);
        assertThat(registry.get("response_cache_hits_total").tag("bucket", "anonymous").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("response_cache_writes_total").tag("bucket", "anonymous").counter().count()).isEqualTo(1.0);
    }

    @Test
    void scenarioB_ageGrowsUntilExpiryThenMiss() {
        fetch(BASIC_QUERY);

        clock.advanceSeconds(5);
        CachedQueryResponse partway = fetch(BASIC_QUERY);
        assertThat(partway.cacheHit()).isTrue();
        assertThat(partway.headers().age()).isEqualTo(5L);
        assertThat(partway.headers().cacheControl()).isEqualTo("max-age=10, public");

        clock.advanceSeconds(6);
        CachedQueryResponse expired = fetch(BASIC_QUERY);
        assertThat(expired.cacheHit()).isFalse();
        assertThat(expired.headers().ageValue()).isEmpty();
        assertThat(expired.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(executor.resolverCallCount("cached")).isEqualTo(2);
    }

    @Test
    void shouldTreatEntryAtExactlyMaxAgeAsExpired() {
        fetch(BASIC_QUERY);

        clock.advanceSeconds(10);

        assertThat(fetch(BASIC_QUERY).cacheHit()).isFalse();
    }

    @Test
    void scenarioC_taintedResponseIsNeverCachedNorAdvertised() {
        for (int i = 0; i < 3; i++) {
            CachedQueryResponse r = fetch("{cached uncached}");
            assertThat(r.cacheHit()).isFalse();
            assertThat(r.headers().cacheControlValue()).isEmpty();
            assertThat(r.headers().ageValue()).isEmpty();
        }
        assertThat(executor.resolverCallCount("uncached")).isEqualTo(3);
        assertThat(store.estimatedSize()).isZero();
        assertThat(registry.get("response_cache_write_skipped_total").tag("reason", "uncacheable").counter().count())
                .isEqualTo(3.0);
    }

    @Test
    void scenarioD_privateResponsesAreKeyedBySession() {
        // without a session: never cached, but still advertised as private
        for (int i = 0; i < 2; i++) {
            CachedQueryResponse r = fetch(QueryRequest.query("{private}"));
            assertThat(r.cacheHit()).isFalse();
            assertThat(r.headers().cacheControl()).isEqualTo("max-age=9, private");
        }

        assertThat(fetch(privateQuery("foo")).cacheHit()).isFalse();
        CachedQueryResponse fooAgain = fetch(privateQuery("foo"));
        assertThat(fooAgain.cacheHit()).isTrue();
        assertThat(fooAgain.servedFrom()).isEqualTo(CacheKeyBucket.PRIVATE);
        assertThat(fooAgain.headers().cacheControl()).isEqualTo("max-age=9, private");

        assertThat(fetch(privateQuery("bar")).cacheHit()).isFalse();
        assertThat(fetch(QueryRequest.query("{private}")).cacheHit()).isFalse();

        assertThat(executor.resolverCallCount("private")).isEqualTo(5);
    }

    @Test
    void scenarioE_readPolicyDenialForcesMiss() {
        fetch(BASIC_QUERY);

        CachedQueryResponse forced = fetch(QueryRequest.query(BASIC_QUERY).withHeader("no-read-from-cache", "y"));

        assertThat(forced.cacheHit()).isFalse();
        assertThat(forced.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(executor.resolverCallCount("cached")).isEqualTo(2);
        // entry is still there for everyone else
        assertThat(fetch(BASIC_QUERY).cacheHit()).isTrue();
    }

    @Test
    void scenarioE_writePolicyDenialLeavesStoreEmpty() {
        CachedQueryResponse r = fetch(QueryRequest.query(BASIC_QUERY).withHeader("no-write-to-cache", "y"));
        assertThat(r.headers().cacheControl()).isEqualTo("max-age=10, public");

        assertThat(fetch(BASIC_QUERY).cacheHit()).isFalse();
        assertThat(fetch(BASIC_QUERY).cacheHit()).isTrue();
    }

    @Test
    void shouldMissOnRawWhitespaceAndAliasDifferences() {
        fetch(BASIC_QUERY);

        assertThat(fetch("{       cached           }").cacheHit()).isFalse();
        CachedQueryResponse aliased = fetch("{alias: cached}");
        assertThat(aliased.cacheHit()).isFalse();
        assertThat(aliased.body()).contains("\"alias\":\"value:cached\"");
    }

    @Test
    void shouldCacheSeparatelyPerExtraKeyData() {
        fetch(BASIC_QUERY);

        QueryRequest withExtra = QueryRequest.query(BASIC_QUERY).withHeader("extra-cache-key-data", "foo");
        assertThat(fetch(withExtra).cacheHit()).isFalse();
        assertThat(fetch(withExtra).cacheHit()).isTrue();
        assertThat(fetch(BASIC_QUERY).cacheHit()).isTrue();
    }

    @Test
    void shouldShareAuthenticatedPublicBucketAcrossSessions() {
        fetch(BASIC_QUERY);

        CachedQueryResponse bar = fetch(QueryRequest.query(BASIC_QUERY).withHeader("session-id", "bar"));
        assertThat(bar.cacheHit()).isFalse();
        assertThat(bar.headers().cacheControl()).isEqualTo("max-age=10, public");

        CachedQueryResponse baz = fetch(QueryRequest.query(BASIC_QUERY).withHeader("session-id", "baz"));
        assertThat(baz.cacheHit()).isTrue();
        assertThat(baz.servedFrom()).isEqualTo(CacheKeyBucket.AUTHENTICATED_PUBLIC);
        assertThat(baz.headers().age()).isZero();

        CachedQueryResponse anonymous = fetch(BASIC_QUERY);
        assertThat(anonymous.cacheHit()).isTrue();
        assertThat(anonymous.servedFrom()).isEqualTo(CacheKeyBucket.ANONYMOUS_PUBLIC);
    }

    @Test
    void shouldLetSessionsShareAnonymousBucketWhenAuthenticatedBucketDisabled() {
        engine = engine(store, headerDrivenOptions().build(), false);

        fetch(BASIC_QUERY);
        CachedQueryResponse bar = fetch(QueryRequest.query(BASIC_QUERY).withHeader("session-id", "bar"));

        assertThat(bar.cacheHit()).isTrue();
        assertThat(bar.servedFrom()).isEqualTo(CacheKeyBucket.ANONYMOUS_PUBLIC);
    }

    @Test
    void shouldAwaitAsynchronousReadAndWritePredicates() {
        engine = engine(store, ResponseCacheOptions.builder()
                .shouldReadFromCache(request -> CompletableFuture.supplyAsync(
                        () -> !request.documentText().contains("greeting")))
                .shouldWriteToCache(request -> CompletableFuture.supplyAsync(() -> true))
                .build(), true);

        fetch(BASIC_QUERY);
        assertThat(fetch(BASIC_QUERY).cacheHit()).isTrue();

        fetch("{ greeting }");
        assertThat(fetch("{ greeting }").cacheHit()).isFalse();
        assertThat(executor.resolverCallCount("greeting")).isEqualTo(2);
    }

    @Test
    void shouldHonourAsynchronousWriteDenial() {
        engine = engine(store, ResponseCacheOptions.builder()
                .shouldWriteToCache(request -> CompletableFuture.supplyAsync(() -> false))
                .build(), true);

        fetch(BASIC_QUERY);
        CachedQueryResponse second = fetch(BASIC_QUERY);

        assertThat(second.cacheHit()).isFalse();
        assertThat(second.headers().cacheControl()).isEqualTo("max-age=10, public");
    }

    @Test
    void shouldTreatFailingPredicateAsDenialAndReportIt() {
        engine = engine(store, ResponseCacheOptions.builder()
                .shouldReadFromCache(request -> {
                    throw new IllegalStateException("flags unavailable");
                })
                .build(), true);

        fetch(BASIC_QUERY);
        CachedQueryResponse second = fetch(BASIC_QUERY);

        assertThat(second.cacheHit()).isFalse();
        assertThat(reported).hasSize(2).allMatch(e -> e instanceof PolicyPredicateException);
        // writes are unaffected by a failing read predicate
        assertThat(store.estimatedSize()).isEqualTo(1);
    }

    @Test
    void shouldDegradeToPassThroughWhenStoreFails() {
        AtomicInteger calls = new AtomicInteger();
        ResponseCacheStore broken = new ResponseCacheStore() {
            @Override
            public CompletableFuture<Optional<StoreEntry>> get(String key) {
                calls.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("store down"));
            }

            @Override
            public CompletableFuture<Void> set(String key, StoreEntry entry, Duration ttl) {
                calls.incrementAndGet();
                throw new IllegalStateException("store down");
            }
        };
        engine = engine(broken, headerDrivenOptions().build(), true);

        CachedQueryResponse r = fetch(BASIC_QUERY);

        assertThat(r.cacheHit()).isFalse();
        assertThat(r.body()).contains("value:cached");
        assertThat(r.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(calls).hasValue(2);
        assertThat(reported).hasSize(2).allMatch(e -> e instanceof StorePermanentException);
        assertThat(registry.get("response_cache_write_skipped_total").tag("reason", "store_error").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldExecuteUncachedWhenVariablesCannotBeSerialized() {
        QueryRequest request = new QueryRequest(BASIC_QUERY, null, Map.of("bad", new Object()),
                OperationType.QUERY, Map.of());

        CachedQueryResponse r = fetch(request);

        assertThat(r.cacheHit()).isFalse();
        assertThat(r.body()).contains("value:cached");
        assertThat(reported).singleElement().isInstanceOf(KeyDerivationException.class);
        assertThat(store.estimatedSize()).isZero();
    }

    @Test
    void shouldExecuteUncachedWhenVariableNameIsNull() {
        Map<String, Object> vars = new HashMap<>();
        vars.put(null, 1);
        QueryRequest request = new QueryRequest(BASIC_QUERY, null, vars, OperationType.QUERY, Map.of());

        CachedQueryResponse r = fetch(request);

        assertThat(r.cacheHit()).isFalse();
        assertThat(r.body()).contains("value:cached");
        assertThat(r.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(reported).singleElement().isInstanceOf(KeyDerivationException.class);
        assertThat(store.estimatedSize()).isZero();
        assertThat(registry.get("response_cache_write_skipped_total").tag("reason", "key_derivation").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldTagSkippedWriteWhenSessionResolutionFails() {
        engine = engine(store, headerDrivenOptions()
                .sessionId(request -> {
                    throw new IllegalStateException("session lookup failed");
                })
                .build(), true);

        CachedQueryResponse r = fetch(BASIC_QUERY);

        assertThat(r.cacheHit()).isFalse();
        assertThat(r.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(reported).singleElement().isInstanceOf(KeyDerivationException.class);
        assertThat(store.estimatedSize()).isZero();
        assertThat(registry.get("response_cache_write_skipped_total").tag("reason", "key_derivation").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("response_cache_write_skipped_total").tag("reason", "disabled").counter()).isNull();
    }

    @Test
    void shouldNeverCacheMutations() {
        QueryRequest mutation = new QueryRequest("mutation { touch }", null, Map.of(), OperationType.MUTATION, Map.of());

        CachedQueryResponse first = fetch(mutation);
        CachedQueryResponse second = fetch(mutation);

        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isFalse();
        assertThat(second.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(executor.resolverCallCount("touch")).isEqualTo(2);
        assertThat(store.estimatedSize()).isZero();
    }

    @Test
    void shouldNeitherStoreNorAdvertiseResponsesWithErrors() {
        QueryExecutor failingField = request -> CompletableFuture.completedFuture(new ExecutionResult(
                "{\"errors\":[{\"message\":\"boom\"}],\"data\":{\"cached\":null}}",
                List.of(FieldCacheHint.of("cached", CacheHint.publicFor(10))),
                List.of("boom")));

        CachedQueryResponse r = engine.execute(QueryRequest.query(BASIC_QUERY), failingField).join();

        assertThat(r.headers().cacheControlValue()).isEmpty();
        assertThat(store.estimatedSize()).isZero();
    }

    @Test
    void shouldPropagateExecutorFailures() {
        QueryExecutor exploding = request -> CompletableFuture.failedFuture(new IllegalStateException("resolver crashed"));

        assertThatThrownBy(() -> engine.execute(QueryRequest.query(BASIC_QUERY), exploding).join())
                .hasRootCauseMessage("resolver crashed");
    }

    @Test
    void shouldPassThroughWhenDisabledButStillComputeHeaders() {
        engine = engine(store, headerDrivenOptions().enabled(false).build(), true);

        fetch(BASIC_QUERY);
        CachedQueryResponse second = fetch(BASIC_QUERY);

        assertThat(second.cacheHit()).isFalse();
        assertThat(second.headers().cacheControl()).isEqualTo("max-age=10, public");
        assertThat(store.estimatedSize()).isZero();
    }

    @Test
    void shouldReturnIdenticalPayloadForRepeatedWritesOfSameResponse() {
        fetch(BASIC_QUERY);
        clock.advanceSeconds(11);
        fetch(BASIC_QUERY);
        clock.advanceSeconds(3);

        CachedQueryResponse hit = fetch(BASIC_QUERY);

        assertThat(hit.cacheHit()).isTrue();
        assertThat(hit.body()).isEqualTo("{\"data\":{\"cached\":\"value:cached\"}}");
        assertThat(hit.headers().age()).isEqualTo(3L);
    }

    @Nested
    class StateMachine {

        @Test
        void shouldWalkMissPathThroughWriting() {
            CacheRequestContext ctx = engine.newContext(QueryRequest.query(BASIC_QUERY));

            Optional<CachedQueryResponse> cached = engine.lookup(ctx).join();
            assertThat(cached).isEmpty();
            ExecutionResult result = executor.execute(ctx.getRequest()).join();
            engine.afterExecution(ctx, result).join();

            assertThat(ctx.history()).containsExactly(
                    START, CHECKING_READ_POLICY, LOOKUP, MISS_EXECUTING, AGGREGATING,
                    CHECKING_WRITE_POLICY, WRITING, RESPONDING, END);
            assertThat(ctx.getWrittenBucket()).isEqualTo(CacheKeyBucket.ANONYMOUS_PUBLIC);
            assertThat(ctx.getPolicy().maxAge()).isEqualTo(10);
        }

        @Test
        void shouldWalkHitPathWithoutExecuting() {
            fetch(BASIC_QUERY);
            CacheRequestContext ctx = engine.newContext(QueryRequest.query(BASIC_QUERY));

            Optional<CachedQueryResponse> cached = engine.lookup(ctx).join();

            assertThat(cached).isPresent();
            assertThat(ctx.history()).containsExactly(START, CHECKING_READ_POLICY, LOOKUP, HIT, RESPONDING, END);
            assertThat(ctx.getMatchedBucket()).isEqualTo(CacheKeyBucket.ANONYMOUS_PUBLIC);
        }

        @Test
        void shouldSkipWriteForPrivateResponseWithoutSession() {
            CacheRequestContext ctx = engine.newContext(QueryRequest.query("{private}"));

            engine.lookup(ctx).join();
            engine.afterExecution(ctx, executor.execute(ctx.getRequest()).join()).join();

            assertThat(ctx.history()).endsWith(CHECKING_WRITE_POLICY, SKIPPED, RESPONDING, END);
            assertThat(ctx.getWrittenBucket()).isNull();
        }
    }

    private CachedQueryResponse fetch(String document) {
        return fetch(QueryRequest.query(document));
    }

    private CachedQueryResponse fetch(QueryRequest request) {
        return engine.execute(request, executor).join();
    }

    private static QueryRequest privateQuery(String session) {
        return QueryRequest.query("{private}").withHeader("session-id", session);
    }

    private static ResponseCacheOptions.ResponseCacheOptionsBuilder headerDrivenOptions() {
        return ResponseCacheOptions.builder()
                .sessionId(request -> request.header("session-id"))
                .extraCacheKeyData(request -> request.header("extra-cache-key-data"))
                .shouldReadFromCache(CachePredicate.of(request -> request.header("no-read-from-cache") == null))
                .shouldWriteToCache(CachePredicate.of(request -> request.header("no-write-to-cache") == null));
    }

    private ResponseCacheEngine engine(ResponseCacheStore store, ResponseCacheOptions options, boolean authenticatedPublicBucket) {
        return new ResponseCacheEngine(
                store,
                new CacheKeyBuilder(authenticatedPublicBucket),
                new CacheHintAggregator(),
                new CacheHeaderTranslator(),
                options,
                new ResponseCacheMetrics(registry),
                reported::add,
                clock
        );
    }
}
