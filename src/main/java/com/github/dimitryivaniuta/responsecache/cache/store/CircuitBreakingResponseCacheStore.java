package com.github.dimitryivaniuta.responsecache.cache.store;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Decorates a store with a Resilience4j circuit breaker.
 *
 * <p>Every failure (synchronous throw, exceptional completion, or a call rejected while the
 * breaker is open) surfaces as a {@link StorePermanentException}. While open, the delegate is not
 * called at all, so a dead backend costs the request nothing but a failed future.
 */
@Slf4j
public final class CircuitBreakingResponseCacheStore implements ResponseCacheStore {

    private final ResponseCacheStore delegate;
    private final CircuitBreaker circuitBreaker;

    public CircuitBreakingResponseCacheStore(ResponseCacheStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
    }

    @Override
    public CompletableFuture<Optional<StoreEntry>> get(String key) {
        return guard("get", () -> delegate.get(key));
    }

    @Override
    public CompletableFuture<Void> set(String key, StoreEntry entry, Duration ttl) {
        return guard("set", () -> delegate.set(key, entry, ttl));
    }

    public CircuitBreaker.State state() {
        return circuitBreaker.getState();
    }

    @Override
    public void close() {
        delegate.close();
    }

    private <T> CompletableFuture<T> guard(String operation, Supplier<CompletableFuture<T>> call) {
        Supplier<CompletionStage<T>> decorated = CircuitBreaker.decorateCompletionStage(circuitBreaker, () -> {
            try {
                return call.get();
            } catch (RuntimeException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        });

        final CompletionStage<T> stage;
        try {
            stage = decorated.get();
        } catch (CallNotPermittedException ex) {
            return CompletableFuture.failedFuture(translate(operation, ex));
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, ex) -> {
            if (ex == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(translate(operation, ex));
            }
        });
        return result;
    }

    private StorePermanentException translate(String operation, Throwable ex) {
        Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
        if (cause instanceof StorePermanentException spe) {
            return spe;
        }
        if (cause instanceof CallNotPermittedException) {
            log.debug("Store {} rejected, circuit breaker {} is {}", operation, circuitBreaker.getName(), circuitBreaker.getState());
            return new StorePermanentException("Response cache store unavailable (circuit open)", cause);
        }
        return new StorePermanentException("Response cache store " + operation + " failed: " + cause.getMessage(), cause);
    }
}
