package com.github.salilvnair.j1ql.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.j1ql.engine.core.J1qlQueryEngine;
import com.github.salilvnair.j1ql.engine.error.StructuredError;
import com.github.salilvnair.j1ql.engine.model.ExecutionOptions;
import com.github.salilvnair.j1ql.engine.model.ExecutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * JSON entry point for tool hosts: takes the tool arguments, runs the query, and returns the
 * serialized {@link ExecutionResult}.
 */
@Component
@RequiredArgsConstructor
public class J1qlQueryToolExecutor {

    public static final String TOOL_NAME = "run_j1_query";
    public static final String ARG_QUERY = "query";
    public static final String ARG_INCLUDE_DELETED = "includeDeleted";

    private final J1qlQueryEngine engine;
    private final ObjectMapper mapper = new ObjectMapper();

    public String toolName() {
        return TOOL_NAME;
    }

    public String execute(String query) {
        return toJson(engine.execute(query));
    }

    /**
     * Runs the query named by the {@code query} argument. Invalid arguments come back as a
     * serialized failure result, never as an exception.
     */
    public String execute(Map<String, Object> args) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        Object query = safeArgs.get(ARG_QUERY);
        String text = query instanceof String value ? value : null;
        if (text == null || text.isBlank()) {
            return rejected(text, TOOL_NAME + " requires a non-blank '" + ARG_QUERY + "' argument");
        }
        Object includeDeleted = safeArgs.get(ARG_INCLUDE_DELETED);
        Boolean parsedIncludeDeleted = null;
        if (includeDeleted != null) {
            parsedIncludeDeleted = toBoolean(includeDeleted);
            if (parsedIncludeDeleted == null) {
                return rejected(text, "'" + ARG_INCLUDE_DELETED + "' must be true or false, got: " + includeDeleted);
            }
        }
        ExecutionOptions options = ExecutionOptions.builder()
                .includeDeleted(parsedIncludeDeleted)
                .build();
        return toJson(engine.execute(text, options));
    }

    private String rejected(String query, String message) {
        return toJson(ExecutionResult.failure(query, new StructuredError.TransportFailure(message), Instant.now().toString()));
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equals(normalized)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private String toJson(ExecutionResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize J1QL execution result", e);
        }
    }
}
