package com.github.salilvnair.j1ql.engine.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.j1ql.engine.constants.J1qlConstants;
import com.github.salilvnair.j1ql.util.JsonUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ResultNormalizer {

    public NormalizedItem normalize(JsonNode record) {
        if (record == null
                || !record.isObject()
                || !record.has(J1qlConstants.RECORD_KEY_ENTITY)
                || !record.has(J1qlConstants.RECORD_KEY_PROPERTIES)) {
            return new NormalizedItem.PassThroughRecord(record);
        }
        JsonNode entity = record.get(J1qlConstants.RECORD_KEY_ENTITY);
        String id = JsonUtil.textOrNull(entity, J1qlConstants.ENTITY_KEY_ID);
        if (id == null) {
            id = JsonUtil.textOrNull(record, J1qlConstants.RECORD_KEY_ID);
        }
        return new NormalizedItem.EntityRecord(
                id,
                entity.get(J1qlConstants.ENTITY_KEY_TYPE),
                entity.get(J1qlConstants.ENTITY_KEY_CLASS),
                JsonUtil.textOrNull(entity, J1qlConstants.ENTITY_KEY_DISPLAY_NAME),
                JsonUtil.textOrNull(entity, J1qlConstants.ENTITY_KEY_INTEGRATION_NAME),
                record.get(J1qlConstants.RECORD_KEY_PROPERTIES));
    }

    public List<NormalizedItem> normalizeAll(List<JsonNode> records) {
        List<NormalizedItem> items = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            items.add(normalize(record));
        }
        return items;
    }
}
