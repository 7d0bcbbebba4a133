package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.github.dimitryivaniuta.responsecache.cache.hint.CachePolicy;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBucket;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyComponents;
import com.github.dimitryivaniuta.responsecache.cache.key.KeyDerivationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-request state carried between the engine's hook points. Owned by one request and
 * accessed sequentially along its future chain; never shared.
 */
@Slf4j
@Getter
public final class CacheRequestContext {

    private final QueryRequest request;
    private final String sessionId;
    private final String extraData;
    private final KeyDerivationException setupFailure;

    private final List<CacheRequestState> history = new ArrayList<>();
    private CacheRequestState state;

    private CacheKeyBucket matchedBucket;
    private CacheKeyBucket writtenBucket;
    private CachePolicy policy;
    private boolean keyDerivationFailed;

    CacheRequestContext(QueryRequest request, String sessionId, String extraData, KeyDerivationException setupFailure) {
        this.request = request;
        this.sessionId = sessionId;
        this.extraData = extraData;
        this.setupFailure = setupFailure;
        this.keyDerivationFailed = setupFailure != null;
        transition(CacheRequestState.START);
    }

    public boolean hasSession() {
        return sessionId != null;
    }

    public CacheKeyComponents keyComponents() {
        return new CacheKeyComponents(
                request.documentText(),
                request.operationName(),
                request.variables(),
                extraData,
                sessionId
        );
    }

    public List<CacheRequestState> history() {
        return Collections.unmodifiableList(history);
    }

    void transition(CacheRequestState next) {
        log.trace("Response cache state {} -> {}", state, next);
        state = next;
        history.add(next);
    }

    void matched(CacheKeyBucket bucket) {
        this.matchedBucket = bucket;
    }

    void written(CacheKeyBucket bucket) {
        this.writtenBucket = bucket;
    }

    void policy(CachePolicy policy) {
        this.policy = policy;
    }

    void keyDerivationFailed() {
        this.keyDerivationFailed = true;
    }
}
