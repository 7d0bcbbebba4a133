package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.github.dimitryivaniuta.responsecache.cache.policy.CachePredicate;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Function;

/**
 * Caller hooks recognized by the engine.
 *
 * - sessionId: identity used for PRIVATE entries and the authenticated bucket; null = anonymous.
 * - extraCacheKeyData: caller-controlled string folded verbatim into the key.
 * - shouldReadFromCache / shouldWriteToCache: eligibility predicates, sync or async.
 */
@Getter
@Builder(toBuilder = true)
public class ResponseCacheOptions {

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final Function<QueryRequest, String> sessionId = request -> null;

    @Builder.Default
    private final Function<QueryRequest, String> extraCacheKeyData = request -> null;

    @Builder.Default
    private final CachePredicate<QueryRequest> shouldReadFromCache = CachePredicate.always();

    @Builder.Default
    private final CachePredicate<QueryRequest> shouldWriteToCache = CachePredicate.always();

    public static ResponseCacheOptions defaults() {
        return ResponseCacheOptions.builder().build();
    }
}
