package com.github.dimitryivaniuta.responsecache.web;

import com.github.dimitryivaniuta.responsecache.cache.engine.CachedQueryResponse;
import com.github.dimitryivaniuta.responsecache.cache.engine.QueryExecutor;
import com.github.dimitryivaniuta.responsecache.cache.engine.QueryRequest;
import com.github.dimitryivaniuta.responsecache.cache.engine.ResponseCacheEngine;
import com.github.dimitryivaniuta.responsecache.cache.http.HttpCacheHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GraphQL-style transport: runs the operation through the response cache and copies the
 * computed Cache-Control / Age onto the HTTP response.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/graphql")
public class QueryController {

    private final ResponseCacheEngine engine;
    private final QueryExecutor executor;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> query(@Valid @RequestBody QueryRequestBody body,
                                        @RequestHeader HttpHeaders headers) {
        QueryRequest request = new QueryRequest(
                body.query(),
                body.operationName(),
                body.variables(),
                executor.plan(body.query()),
                headers.toSingleValueMap()
        );

        CachedQueryResponse response = engine.execute(request, executor).join();

        HttpHeaders out = new HttpHeaders();
        HttpCacheHeaders cache = response.headers();
        cache.cacheControlValue().ifPresent(v -> out.set(HttpCacheHeaders.CACHE_CONTROL, v));
        cache.ageValue().ifPresent(v -> out.set(HttpCacheHeaders.AGE, String.valueOf(v)));

        return ResponseEntity.ok()
                .headers(out)
                .contentType(MediaType.APPLICATION_JSON)
                .body(response.body());
    }
}
