package com.github.dimitryivaniuta.responsecache.cache.engine;

import com.github.dimitryivaniuta.responsecache.cache.hint.FieldCacheHint;

import java.util.List;

/**
 * Output of the execution engine for one operation.
 *
 * @param body   serialized response body (JSON); {@code null} when execution produced no body
 * @param hints  hints visited while resolving, one per resolved field
 * @param errors error messages reported by execution; a response with errors is never cached
 */
public record ExecutionResult(String body, List<FieldCacheHint> hints, List<String> errors) {

    public ExecutionResult {
        hints = (hints == null) ? List.of() : List.copyOf(hints);
        errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public static ExecutionResult of(String body, List<FieldCacheHint> hints) {
        return new ExecutionResult(body, hints, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasBody() {
        return body != null;
    }
}
