package com.github.dimitryivaniuta.responsecache.cache.metrics;

import com.github.dimitryivaniuta.responsecache.cache.ResponseCacheException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default reporter: WARN log + error counter. Never breaks the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingCacheErrorReporter implements CacheErrorReporter {

    private final ResponseCacheMetrics metrics;

    @Override
    public void report(ResponseCacheException error) {
        try {
            metrics.error(error.errorType());
        } catch (RuntimeException metricsEx) {
            log.debug("Unable to record response cache error metric: {}", metricsEx.toString());
        }
        Throwable cause = error.getCause();
        log.warn("Response cache degraded: type={}, reason={}, cause={}",
                error.errorType(), error.getMessage(), cause != null ? cause.toString() : "n/a");
    }
}
