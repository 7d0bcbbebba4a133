package com.github.dimitryivaniuta.responsecache.cache.http;

import java.util.Optional;

/**
 * Outgoing HTTP freshness metadata. Both values are optional; an absent Cache-Control means
 * downstream caches must not reuse the response.
 */
public record HttpCacheHeaders(String cacheControl, Long age) {

    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String AGE = "Age";

    private static final HttpCacheHeaders NONE = new HttpCacheHeaders(null, null);

    public static HttpCacheHeaders none() {
        return NONE;
    }

    public Optional<String> cacheControlValue() {
        return Optional.ofNullable(cacheControl);
    }

    public Optional<Long> ageValue() {
        return Optional.ofNullable(age);
    }
}
