package com.github.salilvnair.j1ql.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResultMetadata(
        String timestamp,
        int count,
        @JsonProperty("has_more") boolean hasMore
) {
}
