package com.github.dimitryivaniuta.responsecache.cache.http;

import com.github.dimitryivaniuta.responsecache.cache.hint.CachePolicy;

/**
 * Converts the computed policy and hit state into {@code Cache-Control} / {@code Age}.
 *
 * <p>Cache-Control always reflects the computed policy, not whether the engine actually stored
 * the response (a write-policy denial or a PRIVATE response without a session still advertises
 * the policy to HTTP caches). Age is only present on a real hit.
 */
public final class CacheHeaderTranslator {

    public HttpCacheHeaders computeHeaders(CachePolicy policy, CacheHitInfo hitInfo) {
        if (policy == null || !policy.isCacheable()) {
            return HttpCacheHeaders.none();
        }
        String cacheControl = "max-age=" + policy.maxAge() + ", " + policy.scope().directive();
        Long age = (hitInfo != null && hitInfo.hit()) ? hitInfo.ageSeconds() : null;
        return new HttpCacheHeaders(cacheControl, age);
    }
}
