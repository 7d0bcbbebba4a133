package com.github.dimitryivaniuta.responsecache.cache.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One incoming operation as seen by the cache.
 *
 * @param documentText  raw operation text, exactly as received
 * @param operationName optional operation name
 * @param variables     operation variables (JSON values)
 * @param operationType kind of operation selected by planning
 * @param headers       transport headers, names lower-cased
 */
public record QueryRequest(
        String documentText,
        String operationName,
        Map<String, Object> variables,
        OperationType operationType,
        Map<String, String> headers
) {

    public QueryRequest {
        Objects.requireNonNull(documentText, "documentText must not be null");
        variables = (variables == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        operationType = (operationType == null) ? OperationType.QUERY : operationType;
        headers = lowerCaseKeys(headers);
    }

    public static QueryRequest query(String documentText) {
        return new QueryRequest(documentText, null, Map.of(), OperationType.QUERY, Map.of());
    }

    public QueryRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name.toLowerCase(Locale.ROOT), value);
        return new QueryRequest(documentText, operationName, variables, operationType, copy);
    }

    /** Header value, or {@code null} when absent or blank. */
    public String header(String name) {
        if (name == null) return null;
        String v = headers.get(name.toLowerCase(Locale.ROOT));
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    public boolean isQuery() {
        return operationType == OperationType.QUERY;
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (k != null && v != null) out.put(k.toLowerCase(Locale.ROOT), v);
        });
        return Collections.unmodifiableMap(out);
    }
}
