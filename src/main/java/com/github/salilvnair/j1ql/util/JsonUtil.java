package com.github.salilvnair.j1ql.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.j1ql.engine.exception.J1qlEngineException;
import com.github.salilvnair.j1ql.engine.exception.J1qlErrorCode;
import lombok.experimental.UtilityClass;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Create empty JSON object */
    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /**
     * Parse a response body. Blank or malformed bodies are a protocol fault.
     */
    public static JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new J1qlEngineException(J1qlErrorCode.RESPONSE_PARSE_FAILED, "J1QL response body is empty");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new J1qlEngineException(
                    J1qlErrorCode.RESPONSE_PARSE_FAILED,
                    J1qlErrorCode.RESPONSE_PARSE_FAILED.defaultMessage() + ": " + e.getOriginalMessage(),
                    e);
        }
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new J1qlEngineException(J1qlErrorCode.REQUEST_SERIALIZATION_FAILED,
                    J1qlErrorCode.REQUEST_SERIALIZATION_FAILED.defaultMessage(), e);
        }
    }

    public static String textOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
