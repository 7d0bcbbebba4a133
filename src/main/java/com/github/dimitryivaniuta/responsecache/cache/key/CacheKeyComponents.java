package com.github.dimitryivaniuta.responsecache.cache.key;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything that makes two requests cache-equivalent.
 *
 * <p>{@code documentText} is the raw operation text as sent by the client; it is never
 * normalized, so whitespace differences produce different keys.
 */
public record CacheKeyComponents(
        String documentText,
        String operationName,
        Map<String, Object> variables,
        String extraData,
        String sessionId
) {

    public CacheKeyComponents {
        Objects.requireNonNull(documentText, "documentText must not be null");
        variables = (variables == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public boolean hasSession() {
        return sessionId != null;
    }
}
