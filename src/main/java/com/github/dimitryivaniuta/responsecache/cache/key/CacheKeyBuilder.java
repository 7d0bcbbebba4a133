package com.github.dimitryivaniuta.responsecache.cache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheScope;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derives store keys from {@link CacheKeyComponents}.
 *
 * <p>Key format: {@code "rc:" + sha256(canonicalJson)} where the canonical JSON holds the raw
 * document, operation name, variables, extra data and a bucket discriminator:
 * <ul>
 *   <li>ANONYMOUS_PUBLIC: {@code sessionMode=NO_SESSION}</li>
 *   <li>AUTHENTICATED_PUBLIC: {@code sessionMode=AUTHENTICATED_PUBLIC} (session identity ignored)</li>
 *   <li>PRIVATE: {@code sessionId=<id>}</li>
 * </ul>
 * Map entries and bean properties are serialized in sorted order, so variable maps that only
 * differ in insertion order produce the same key. Numbers are compared by value:
 * {@code 1}, {@code 1.0} and {@code 1.00} all hash the same.
 *
 * <p>Stateless and thread-safe.
 */
public final class CacheKeyBuilder {

    public static final String KEY_PREFIX = "rc:";

    private final ObjectMapper canonicalMapper;
    private final boolean authenticatedPublicBucket;

    public CacheKeyBuilder(boolean authenticatedPublicBucket) {
        this(defaultCanonicalMapper(), authenticatedPublicBucket);
    }

    public CacheKeyBuilder(ObjectMapper mapper, boolean authenticatedPublicBucket) {
        // copy: canonical ordering must not depend on how the shared mapper is configured
        this.canonicalMapper = mapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.authenticatedPublicBucket = authenticatedPublicBucket;
    }

    public String buildKey(CacheKeyComponents components, CacheKeyBucket bucket) {
        Map<String, Object> keyData = new TreeMap<>();
        keyData.put("source", components.documentText());
        keyData.put("operationName", components.operationName());
        keyData.put("variables", components.variables());
        keyData.put("extra", components.extraData());

        switch (bucket) {
            case ANONYMOUS_PUBLIC -> keyData.put("sessionMode", "NO_SESSION");
            case AUTHENTICATED_PUBLIC -> keyData.put("sessionMode", "AUTHENTICATED_PUBLIC");
            case PRIVATE -> {
                if (!components.hasSession()) {
                    throw new IllegalArgumentException("PRIVATE bucket requires a session id");
                }
                keyData.put("sessionId", components.sessionId());
            }
        }

        final String canonical;
        try {
            canonical = canonicalMapper.writeValueAsString(canonicalValue(keyData));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new KeyDerivationException("Unable to canonicalize cache key components", e);
        }
        return KEY_PREFIX + sha256(canonical);
    }

    /**
     * Buckets to probe on read, in order. The first present entry wins.
     */
    public List<CacheKeyBucket> candidateBuckets(boolean sessionPresent) {
        if (!sessionPresent) {
            return List.of(CacheKeyBucket.ANONYMOUS_PUBLIC);
        }
        return authenticatedPublicBucket
                ? List.of(CacheKeyBucket.PRIVATE, CacheKeyBucket.AUTHENTICATED_PUBLIC)
                : List.of(CacheKeyBucket.PRIVATE, CacheKeyBucket.ANONYMOUS_PUBLIC);
    }

    /**
     * Bucket a fresh response is written to, or empty when it must not be stored
     * (PRIVATE response without a session).
     */
    public Optional<CacheKeyBucket> writeBucket(CacheScope scope, boolean sessionPresent) {
        if (scope == CacheScope.PRIVATE) {
            return sessionPresent ? Optional.of(CacheKeyBucket.PRIVATE) : Optional.empty();
        }
        if (sessionPresent && authenticatedPublicBucket) {
            return Optional.of(CacheKeyBucket.AUTHENTICATED_PUBLIC);
        }
        return Optional.of(CacheKeyBucket.ANONYMOUS_PUBLIC);
    }

    /**
     * Rewrites numbers into one representation per value. Maps keep their entries (the mapper
     * sorts them on output); lists keep their order.
     */
    static Object canonicalValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, canonicalValue(v)));
            return out;
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(CacheKeyBuilder::canonicalValue).toList();
        }
        if (value instanceof BigDecimal decimal) {
            return canonicalNumber(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? canonicalNumber(new BigDecimal(Double.toString(d))) : value;
        }
        return value;
    }

    private static Object canonicalNumber(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() <= 0 ? (Object) stripped.toBigIntegerExact() : stripped;
    }

    private static ObjectMapper defaultCanonicalMapper() {
        return JsonMapper.builder().build();
    }

    private static String sha256(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] b = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(b.length * 2);
            for (byte x : b) sb.append(String.format("%02x", x));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
