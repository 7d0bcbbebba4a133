package com.github.dimitryivaniuta.responsecache.cache.policy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Read/write eligibility check for one request. May complete asynchronously
 * (feature flag lookup, remote entitlement check, ...).
 *
 * @param <R> request type the predicate inspects
 */
@FunctionalInterface
public interface CachePredicate<R> {

    CompletionStage<Boolean> test(R request);

    static <R> CachePredicate<R> always() {
        return request -> CompletableFuture.completedFuture(Boolean.TRUE);
    }

    static <R> CachePredicate<R> never() {
        return request -> CompletableFuture.completedFuture(Boolean.FALSE);
    }

    /** Adapts a synchronous predicate. */
    static <R> CachePredicate<R> of(Predicate<R> predicate) {
        return request -> CompletableFuture.completedFuture(predicate.test(request));
    }

    default CachePredicate<R> and(CachePredicate<R> other) {
        return request -> test(request).thenCompose(first ->
                Boolean.TRUE.equals(first) ? other.test(request) : CompletableFuture.completedFuture(Boolean.FALSE));
    }
}
