package com.github.dimitryivaniuta.responsecache.cache.hint;

import java.util.Collection;

/**
 * Reduces the hints visited during one execution into a single {@link CachePolicy}.
 *
 * <p>maxAge is the minimum over all fields; a field without a hint contributes
 * {@code defaultMaxAge} (0 unless configured), so a single un-hinted field taints the whole
 * response. Scope is PRIVATE as soon as one field is PRIVATE.
 */
public final class CacheHintAggregator {

    private final int defaultMaxAge;

    public CacheHintAggregator() {
        this(0);
    }

    public CacheHintAggregator(int defaultMaxAge) {
        if (defaultMaxAge < 0) {
            throw new IllegalArgumentException("defaultMaxAge must be >= 0, got " + defaultMaxAge);
        }
        this.defaultMaxAge = defaultMaxAge;
    }

    public CachePolicy aggregate(Collection<FieldCacheHint> hints) {
        if (hints == null || hints.isEmpty()) {
            return CachePolicy.uncacheable();
        }

        long maxAge = Long.MAX_VALUE;
        CacheScope scope = CacheScope.PUBLIC;
        boolean sawRoot = false;
        boolean rootsCacheable = true;

        for (FieldCacheHint field : hints) {
            CacheHint hint = field.hint();
            int fieldMaxAge = hint.hasMaxAge() ? hint.maxAge() : defaultMaxAge;
            maxAge = Math.min(maxAge, fieldMaxAge);
            if (hint.isPrivate()) {
                scope = CacheScope.PRIVATE;
            }
            if (field.isRootField()) {
                sawRoot = true;
                rootsCacheable &= hint.hasMaxAge() && hint.maxAge() > 0;
            }
        }

        return new CachePolicy((int) maxAge, scope, sawRoot && rootsCacheable);
    }
}
