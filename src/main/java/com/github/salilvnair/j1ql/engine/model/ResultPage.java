package com.github.salilvnair.j1ql.engine.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.j1ql.engine.constants.J1qlConstants;
import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;
import com.github.salilvnair.j1ql.util.JsonUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One materialized download payload.
 *
 * @param records raw rows in server order
 * @param tree    graph payload of a {@code RETURN TREE} query, otherwise null
 * @param cursor  continuation token, null when the sequence is terminal
 */
public record ResultPage(List<JsonNode> records, JsonNode tree, String cursor) {

    /**
     * Reads a completed download document.
     *
     * @throws J1qlEngineException {@link J1qlErrorCode#RESULT_PAGE_MALFORMED} when the payload is
     *                             not an object carrying a {@code data} field
     */
    public static ResultPage from(JsonNode payload) {
        if (payload == null || !payload.isObject() || !payload.has(J1qlConstants.RESPONSE_KEY_DATA)) {
            throw new J1qlEngineException(J1qlErrorCode.RESULT_PAGE_MALFORMED,
                    J1qlErrorCode.RESULT_PAGE_MALFORMED.defaultMessage() + " (" + describe(payload) + ")");
        }
        JsonNode data = payload.get(J1qlConstants.RESPONSE_KEY_DATA);
        String cursor = JsonUtil.textOrNull(payload, J1qlConstants.RESPONSE_KEY_CURSOR);
        if (cursor != null && cursor.isEmpty()) {
            cursor = null;
        }

        if (data.isObject()
                && data.has(J1qlConstants.RESPONSE_KEY_VERTICES)
                && data.has(J1qlConstants.RESPONSE_KEY_EDGES)) {
            return new ResultPage(List.of(), data, null);
        }

        List<JsonNode> records = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(records::add);
        } else if (!data.isNull()) {
            records.add(data);
        }
        return new ResultPage(List.copyOf(records), null, cursor);
    }

    public boolean isTree() {
        return tree != null;
    }

    public boolean hasCursor() {
        return cursor != null && !cursor.isEmpty();
    }

    private static String describe(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return "null document";
        }
        return payload.isObject() ? "no data field" : payload.getNodeType().name().toLowerCase(Locale.ROOT) + " document";
    }
}
