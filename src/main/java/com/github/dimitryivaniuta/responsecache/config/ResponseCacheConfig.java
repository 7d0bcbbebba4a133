package com.github.dimitryivaniuta.responsecache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheProperties;
import com.github.dimitryivaniuta.responsecache.cache.engine.QueryRequest;
import com.github.dimitryivaniuta.responsecache.cache.engine.ResponseCacheEngine;
import com.github.dimitryivaniuta.responsecache.cache.engine.ResponseCacheOptions;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHintAggregator;
import com.github.dimitryivaniuta.responsecache.cache.http.CacheHeaderTranslator;
import com.github.dimitryivaniuta.responsecache.cache.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.responsecache.cache.metrics.CacheErrorReporter;
import com.github.dimitryivaniuta.responsecache.cache.metrics.ResponseCacheMetrics;
import com.github.dimitryivaniuta.responsecache.cache.policy.CachePredicate;
import com.github.dimitryivaniuta.responsecache.cache.store.CaffeineResponseCacheStore;
import com.github.dimitryivaniuta.responsecache.cache.store.CircuitBreakingResponseCacheStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.function.Function;

/**
 * Wiring for the response cache:
 * - Caffeine local store, bounded by response-cache.max-entries, closed at shutdown
 * - Resilience4j circuit breaker in front of the store
 * - header-driven session / extra key data / read-write switches from ResponseCacheProperties
 */
@Configuration
@EnableConfigurationProperties(ResponseCacheProperties.class)
public class ResponseCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CaffeineResponseCacheStore responseCacheStore(ResponseCacheProperties props, Clock clock) {
        return new CaffeineResponseCacheStore(props.getMaxEntries(), clock);
    }

    @Bean
    public CacheKeyBuilder cacheKeyBuilder(ObjectMapper objectMapper, ResponseCacheProperties props) {
        return new CacheKeyBuilder(objectMapper, props.isAuthenticatedPublicBucket());
    }

    @Bean
    public ResponseCacheOptions responseCacheOptions(ResponseCacheProperties props) {
        return ResponseCacheOptions.builder()
                .enabled(props.isEnabled())
                .sessionId(headerValue(props.getSessionIdHeader()))
                .extraCacheKeyData(headerValue(props.getExtraCacheKeyDataHeader()))
                .shouldReadFromCache(absentHeader(props.getSkipReadHeader()))
                .shouldWriteToCache(absentHeader(props.getSkipWriteHeader()))
                .build();
    }

    @Bean
    public ResponseCacheEngine responseCacheEngine(CaffeineResponseCacheStore store,
                                                   CacheKeyBuilder keyBuilder,
                                                   ResponseCacheOptions options,
                                                   ResponseCacheProperties props,
                                                   ResponseCacheMetrics metrics,
                                                   CacheErrorReporter errorReporter,
                                                   Clock clock) {
        CircuitBreaker breaker = CircuitBreaker.of("responseCacheStore", circuitBreakerConfig(props.getCircuitBreaker()));
        return new ResponseCacheEngine(
                new CircuitBreakingResponseCacheStore(store, breaker),
                keyBuilder,
                new CacheHintAggregator(props.getDefaultMaxAge()),
                new CacheHeaderTranslator(),
                options,
                metrics,
                errorReporter,
                clock
        );
    }

    private static CircuitBreakerConfig circuitBreakerConfig(ResponseCacheProperties.CircuitBreaker cb) {
        return CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(cb.getMinimumNumberOfCalls())
                .waitDurationInOpenState(cb.getWaitDurationInOpenState())
                .build();
    }

    private static Function<QueryRequest, String> headerValue(String header) {
        if (header == null || header.isBlank()) return request -> null;
        return request -> request.header(header);
    }

    private static CachePredicate<QueryRequest> absentHeader(String header) {
        if (header == null || header.isBlank()) return CachePredicate.always();
        return CachePredicate.of(request -> request.header(header) == null);
    }
}
