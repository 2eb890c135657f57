package com.mike.scrapescheduler.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.scrapescheduler.entity.FieldValue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores extracted fields as a JSON object whose values are strings or string arrays.
 */
@Converter
public class FieldMapConverter implements AttributeConverter<Map<String, FieldValue>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Map<String, FieldValue> fields) {
        try {
            return MAPPER.writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise extracted fields", e);
        }
    }

    @Override
    public Map<String, FieldValue> convertToEntityAttribute(String json) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        if (json == null || json.isBlank()) return fields;

        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored field data is not valid JSON", e);
        }

        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode node = entry.getValue();
            if (node.isArray()) {
                List<String> items = new ArrayList<>(node.size());
                node.forEach(item -> items.add(item.asText()));
                fields.put(entry.getKey(), FieldValue.items(items));
            } else {
                fields.put(entry.getKey(), FieldValue.text(node.isNull() ? "" : node.asText()));
            }
        }
        return fields;
    }
}
