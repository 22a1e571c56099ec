package com.github.salilvnair.j1ql.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import lombok.experimental.UtilityClass;

@UtilityClass
public class JsonPathUtil {

    private static final Configuration READ_CONFIG =
            Configuration.builder()
                    .jsonProvider(new JacksonJsonNodeJsonProvider())
                    .mappingProvider(new JacksonMappingProvider())
                    .options(Option.SUPPRESS_EXCEPTIONS, Option.DEFAULT_PATH_LEAF_TO_NULL)
                    .build();

    /**
     * Reads a single textual leaf. Missing paths, nulls and non-text values return null.
     */
    public static String readText(JsonNode json, String path) {
        if (json == null || path == null || path.isBlank()) {
            return null;
        }
        Object value = JsonPath.using(READ_CONFIG).parse(json).read(path);
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof JsonNode node && node.isTextual()) {
            return node.asText();
        }
        return null;
    }
}
