package com.github.dimitryivaniuta.responsecache.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static com.github.dimitryivaniuta.responsecache.web.RequestContextKeys.CORRELATION_ID_HEADER;
import static com.github.dimitryivaniuta.responsecache.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

/**
 * Binds a correlation id to the request (MDC + response header) and logs, under that id, how the
 * response cache answered: {@code hit} (Age present), {@code cacheable} or {@code uncached}.
 * Caller-supplied ids that are too long or carry unsafe characters are replaced.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String corr = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(CORRELATION_ID_HEADER, corr);

        long start = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} cache={} cache-control=[{}] in {} ms",
                        request.getMethod(), request.getRequestURI(), response.getStatus(),
                        cacheOutcome(response), response.getHeader(HttpHeaders.CACHE_CONTROL),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    static String resolveCorrelationId(String incoming) {
        if (incoming != null && SAFE_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString();
    }

    static String cacheOutcome(HttpServletResponse response) {
        if (response.getHeader(HttpHeaders.AGE) != null) return "hit";
        if (response.getHeader(HttpHeaders.CACHE_CONTROL) != null) return "cacheable";
        return "uncached";
    }
}
