package com.github.salilvnair.j1ql.engine.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.j1ql.util.JsonUtil;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.j1ql.support.J1qlFixtures.entityRecord;
import static com.github.salilvnair.j1ql.support.TestConstants.ENTITY_ID;
import static com.github.salilvnair.j1ql.support.TestConstants.ENTITY_NAME;
import static com.github.salilvnair.j1ql.support.TestConstants.INTEGRATION_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultNormalizerTest {

    private final ResultNormalizer normalizer = new ResultNormalizer();

    @Test
    void entityShapedRecordIsFlattened() {
        JsonNode raw = JsonUtil.parse(entityRecord(ENTITY_ID, ENTITY_NAME, INTEGRATION_NAME));

        NormalizedItem.EntityRecord item = assertInstanceOf(NormalizedItem.EntityRecord.class, normalizer.normalize(raw));

        assertEquals(ENTITY_ID, item.id());
        assertEquals("aws_instance", item.type().get(0).asText());
        assertEquals("Host", item.entityClass().get(0).asText());
        assertEquals(ENTITY_NAME, item.name());
        assertEquals(INTEGRATION_NAME, item.integrationName());
        assertTrue(item.properties().get("active").asBoolean());
    }

    @Test
    void entityIdFallsBackToRecordId() {
        JsonNode raw = JsonUtil.parse("{\"id\":\"outer\",\"entity\":{\"displayName\":\"db\"},\"properties\":{}}");

        NormalizedItem.EntityRecord item = assertInstanceOf(NormalizedItem.EntityRecord.class, normalizer.normalize(raw));

        assertEquals("outer", item.id());
        assertEquals("db", item.name());
    }

    @Test
    void aggregateRecordPassesThroughUnchanged() throws Exception {
        String json = "{\"count(u)\":42,\"entity\":{\"_id\":\"only-entity\"}}";
        JsonNode raw = JsonUtil.parse(json);

        NormalizedItem item = normalizer.normalize(raw);

        NormalizedItem.PassThroughRecord passThrough = assertInstanceOf(NormalizedItem.PassThroughRecord.class, item);
        assertSame(raw, passThrough.raw());
        assertEquals(json, new ObjectMapper().writeValueAsString(item));
    }

    @Test
    void scalarRecordPassesThrough() {
        JsonNode raw = JsonUtil.parse("[1,2]").get(0);

        assertInstanceOf(NormalizedItem.PassThroughRecord.class, normalizer.normalize(raw));
    }

    @Test
    void entityRecordSerializesWithClassKey() throws Exception {
        JsonNode raw = JsonUtil.parse(entityRecord(ENTITY_ID, ENTITY_NAME, INTEGRATION_NAME));

        JsonNode serialized = JsonUtil.parse(new ObjectMapper().writeValueAsString(normalizer.normalize(raw)));

        assertEquals("Host", serialized.get("class").get(0).asText());
        assertEquals(ENTITY_NAME, serialized.get("name").asText());
        assertEquals(INTEGRATION_NAME, serialized.get("integrationName").asText());
    }
}
