package com.github.salilvnair.j1ql.engine.normalize;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

public sealed interface NormalizedItem permits NormalizedItem.EntityRecord, NormalizedItem.PassThroughRecord {

    /**
     * Flattened {@code {entity, properties}} result row.
     */
    record EntityRecord(
            String id,
            JsonNode type,
            @JsonProperty("class") JsonNode entityClass,
            String name,
            String integrationName,
            JsonNode properties
    ) implements NormalizedItem {
    }

    /**
     * Aggregate, scalar or tree row kept exactly as the server returned it.
     */
    record PassThroughRecord(@JsonValue JsonNode raw) implements NormalizedItem {
    }
}
