package com.github.dimitryivaniuta.responsecache.sample;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.responsecache.cache.engine.ExecutionResult;
import com.github.dimitryivaniuta.responsecache.cache.engine.OperationType;
import com.github.dimitryivaniuta.responsecache.cache.engine.QueryExecutor;
import com.github.dimitryivaniuta.responsecache.cache.engine.QueryRequest;
import com.github.dimitryivaniuta.responsecache.cache.hint.CacheHint;
import com.github.dimitryivaniuta.responsecache.cache.hint.FieldCacheHint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal execution engine for the demo schema: flat selection sets only
 * ({@code { cached uncached }}, {@code query Q { alias: cached }}, {@code mutation { touch }}).
 * Every resolved field returns {@code "value:<field>"} and counts its resolver calls, so a cache hit
 * is observable as an unchanged count.
 */
@Component
@RequiredArgsConstructor
public class DemoQueryExecutor implements QueryExecutor {

    private final ObjectMapper objectMapper;

    private final ConcurrentHashMap<String, AtomicInteger> resolverCalls = new ConcurrentHashMap<>();

    @Override
    public OperationType plan(String documentText) {
        String head = documentText.stripLeading().toLowerCase(Locale.ROOT);
        if (head.startsWith("mutation")) return OperationType.MUTATION;
        if (head.startsWith("subscription")) return OperationType.SUBSCRIPTION;
        return OperationType.QUERY;
    }

    @Override
    public CompletableFuture<ExecutionResult> execute(QueryRequest request) {
        boolean mutation = request.operationType() == OperationType.MUTATION;
        List<Selection> selections;
        try {
            selections = parseSelections(request.documentText());
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.completedFuture(errorResult(ex.getMessage()));
        }

        ObjectNode data = objectMapper.createObjectNode();
        List<FieldCacheHint> hints = new ArrayList<>();
        for (Selection selection : selections) {
            Optional<CacheHint> hint = mutation
                    ? DemoSchema.mutationField(selection.field())
                    : DemoSchema.queryField(selection.field());
            if (hint.isEmpty()) {
                return CompletableFuture.completedFuture(
                        errorResult("Cannot query field \"" + selection.field() + "\""));
            }
            resolverCalls.computeIfAbsent(selection.field(), k -> new AtomicInteger()).incrementAndGet();
            data.put(selection.responseKey(), "value:" + selection.field());
            hints.add(FieldCacheHint.of(selection.responseKey(), hint.get()));
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.set("data", data);
        return CompletableFuture.completedFuture(ExecutionResult.of(write(body), hints));
    }

    public int resolverCallCount(String field) {
        AtomicInteger n = resolverCalls.get(field);
        return n == null ? 0 : n.get();
    }

    public void resetCounters() {
        resolverCalls.clear();
    }

    private ExecutionResult errorResult(String message) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("errors").addObject().put("message", message);
        body.putNull("data");
        return new ExecutionResult(write(body), List.of(), List.of(message));
    }

    private String write(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize response body", e);
        }
    }

    static List<Selection> parseSelections(String document) {
        int open = document.indexOf('{');
        int close = document.lastIndexOf('}');
        if (open < 0 || close < open) {
            throw new IllegalArgumentException("Syntax Error: expected selection set");
        }
        String inner = document.substring(open + 1, close).replace(":", " : ");
        if (inner.indexOf('{') >= 0) {
            throw new IllegalArgumentException("Nested selections are not supported by the demo schema");
        }

        String[] tokens = inner.trim().split("[\\s,]+");
        List<Selection> out = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            String t = tokens[i];
            if (t.isEmpty()) continue;
            if (i + 2 < tokens.length && ":".equals(tokens[i + 1])) {
                out.add(new Selection(t, tokens[i + 2]));
                i += 2;
            } else if (":".equals(t)) {
                throw new IllegalArgumentException("Syntax Error: unexpected ':'");
            } else {
                out.add(new Selection(t, t));
            }
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("Syntax Error: empty selection set");
        }
        return out;
    }

    record Selection(String responseKey, String field) {}
}
