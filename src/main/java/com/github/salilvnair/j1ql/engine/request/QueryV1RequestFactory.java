package com.github.salilvnair.j1ql.engine.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.j1ql.config.J1qlClientConfig;
import com.github.salilvnair.j1ql.engine.constants.J1qlConstants;
import com.github.salilvnair.j1ql.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@code queryV1} submission: endpoint, credential headers and GraphQL body.
 */
@Component
public class QueryV1RequestFactory {

    private final J1qlClientConfig config;

    public QueryV1RequestFactory(J1qlClientConfig config) {
        this.config = config;
    }

    public String endpoint() {
        return config.resolveBaseUrl();
    }

    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(J1qlConstants.HEADER_AUTHORIZATION,
                J1qlConstants.BEARER_PREFIX + " " + Objects.requireNonNullElse(config.getApiKey(), ""));
        headers.put(J1qlConstants.HEADER_ACCOUNT, Objects.requireNonNullElse(config.getAccountId(), ""));
        headers.put(J1qlConstants.HEADER_CONTENT_TYPE, J1qlConstants.APPLICATION_JSON);
        return Collections.unmodifiableMap(headers);
    }

    public String submissionBody(String query, String cursor, boolean includeDeleted) {
        ObjectNode variables = JsonUtil.object();
        variables.put(J1qlConstants.VAR_QUERY, query);
        variables.put(J1qlConstants.VAR_INCLUDE_DELETED, includeDeleted);
        variables.put(J1qlConstants.VAR_DEFERRED_RESPONSE, J1qlConstants.DEFERRED_RESPONSE_FORCE);
        variables.putObject(J1qlConstants.VAR_FLAGS).put(J1qlConstants.VAR_VARIABLE_RESULT_SIZE, true);
        if (cursor != null && !cursor.isEmpty()) {
            variables.put(J1qlConstants.VAR_CURSOR, cursor);
        }

        ObjectNode body = JsonUtil.object();
        body.put(J1qlConstants.VAR_QUERY, J1qlConstants.QUERY_V1_DOCUMENT);
        body.set(J1qlConstants.VAR_VARIABLES, variables);
        return JsonUtil.toJson(body);
    }
}
