package com.github.dimitryivaniuta.responsecache.sample;

import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHint;

import java.util.Map;
import java.util.Optional;

/**
 * Fields of the demo schema and the cache hints their definitions carry:
 *
 * <pre>
 * type Query {
 *   cached: String   @cacheControl(maxAge: 10)
 *   uncached: String
 *   private: String  @cacheControl(maxAge: 9, scope: PRIVATE)
 *   greeting: String @cacheControl(maxAge: 60)
 * }
 * type Mutation {
 *   touch: String    @cacheControl(maxAge: 10)
 * }
 * </pre>
 */
public final class DemoSchema {

    private static final Map<String, CacheHint> QUERY_FIELDS = Map.of(
            "cached", CacheHint.publicFor(10),
            "uncached", CacheHint.none(),
            "private", CacheHint.privateFor(9),
            "greeting", CacheHint.publicFor(60)
    );

    private static final Map<String, CacheHint> MUTATION_FIELDS = Map.of(
            "touch", CacheHint.publicFor(10)
    );

    private DemoSchema() {}

    public static Optional<CacheHint> queryField(String name) {
        return Optional.ofNullable(QUERY_FIELDS.get(name));
    }

    public static Optional<CacheHint> mutationField(String name) {
        return Optional.ofNullable(MUTATION_FIELDS.get(name));
    }
}
