package com.github.dimitryivaniuta.responsecache.cache.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Evaluates the caller-registered read/write predicates.
 *
 * <p>A predicate that throws, returns {@code null} or completes exceptionally is a denial:
 * the returned future completes with {@code false} and the failure is handed to the error sink
 * as a {@link PolicyPredicateException}. The returned future itself never fails.
 *
 * @param <R> request type
 */
@Slf4j
public final class PolicyGate<R> {

    public enum Decision {
        READ("read"),
        WRITE("write");

        private final String tag;

        Decision(String tag) { this.tag = tag; }

        public String tag() { return tag; }
    }

    private final CachePredicate<R> readPredicate;
    private final CachePredicate<R> writePredicate;

    public PolicyGate(CachePredicate<R> readPredicate, CachePredicate<R> writePredicate) {
        this.readPredicate = readPredicate != null ? readPredicate : CachePredicate.always();
        this.writePredicate = writePredicate != null ? writePredicate : CachePredicate.always();
    }

    public CompletableFuture<Boolean> mayRead(R request, Consumer<PolicyPredicateException> errorSink) {
        return evaluate(Decision.READ, readPredicate, request, errorSink);
    }

    public CompletableFuture<Boolean> mayWrite(R request, Consumer<PolicyPredicateException> errorSink) {
        return evaluate(Decision.WRITE, writePredicate, request, errorSink);
    }

    private CompletableFuture<Boolean> evaluate(Decision decision,
                                                CachePredicate<R> predicate,
                                                R request,
                                                Consumer<PolicyPredicateException> errorSink) {
        Objects.requireNonNull(errorSink, "errorSink must not be null");

        final CompletionStage<Boolean> stage;
        try {
            stage = predicate.test(request);
        } catch (RuntimeException ex) {
            return CompletableFuture.completedFuture(deny(decision, ex, errorSink));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(
                    deny(decision, new IllegalStateException("predicate returned null"), errorSink));
        }

        return stage.toCompletableFuture().handle((allowed, ex) -> {
            if (ex != null) {
                return deny(decision, unwrap(ex), errorSink);
            }
            if (allowed == null) {
                return deny(decision, new IllegalStateException("predicate completed with null"), errorSink);
            }
            log.debug("Cache {} policy evaluated: {}", decision.tag(), allowed);
            return allowed;
        });
    }

    private static boolean deny(Decision decision, Throwable cause, Consumer<PolicyPredicateException> errorSink) {
        errorSink.accept(new PolicyPredicateException(decision,
                "Cache " + decision.tag() + " predicate failed: " + cause.getMessage(), cause));
        return false;
    }

    private static Throwable unwrap(Throwable ex) {
        return (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
    }
}
