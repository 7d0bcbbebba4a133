package com.github.dimitryivaniuta.responsecache.cache;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "response-cache")
public class ResponseCacheProperties {

    private boolean enabled = true;

    // bound of the default in-process store
    @Min(1)
    private long maxEntries = 10_000;

    // maxAge applied to fields without a hint; 0 = un-hinted fields taint the response
    @Min(0)
    private int defaultMaxAge = 0;

    // PUBLIC responses for callers with a session go to a bucket shared by all sessions
    private boolean authenticatedPublicBucket = true;

    private String sessionIdHeader = "session-id";
    private String extraCacheKeyDataHeader = "extra-cache-key-data";

    // presence of these request headers disables read / write for that request (blank = off)
    private String skipReadHeader = "";
    private String skipWriteHeader = "";

    @Valid
    @NotNull
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Getter
    @Setter
    public static class CircuitBreaker {
        private float failureRateThreshold = 50.0f;
        @Min(1)
        private int slidingWindowSize = 20;
        @Min(1)
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }
}
