package com.github.salilvnair.j1ql.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.j1ql.engine.error.StructuredError;
import com.github.salilvnair.j1ql.engine.normalize.NormalizedItem;

import java.util.List;

/**
 * Terminal output of one execution. Either {@code success} with {@code results}, or a failure
 * carrying only {@code error}; partial results are never surfaced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
        boolean success,
        String query,
        List<NormalizedItem> results,
        ResultMetadata metadata,
        StructuredError error
) {

    public static ExecutionResult success(String query, List<NormalizedItem> results, String timestamp, boolean hasMore) {
        List<NormalizedItem> safeResults = List.copyOf(results);
        return new ExecutionResult(true, query, safeResults,
                new ResultMetadata(timestamp, safeResults.size(), hasMore), null);
    }

    public static ExecutionResult failure(String query, StructuredError error, String timestamp) {
        return new ExecutionResult(false, query, List.of(), new ResultMetadata(timestamp, 0, false), error);
    }
}
