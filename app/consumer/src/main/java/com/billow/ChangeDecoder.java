package com.billow;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses the payloads produced by the wal2json plugin into change events. A
 * payload holds the changes of one transaction:
 *
 * <pre>
 * {"change": [{"kind": "insert", "schema": "public", "table": "tasks",
 *              "columnvalues": [{"name": "user_id", "value": "..."}, ...]}, ...]}
 * </pre>
 *
 * Besides the name/value pairs above, the layout with parallel
 * {@code columnnames} and {@code columnvalues} arrays is accepted too. Deletes
 * carry no column values, for them the {@code oldkeys} object is used. No
 * filtering is done here.
 */
public class ChangeDecoder {
    private final ObjectMapper objectMapper;

    public ChangeDecoder() {
        this(new ObjectMapper());
    }

    /**
     * Create a decoder using the given object mapper for parsing.
     *
     * @param objectMapper
     *            The mapper to parse payloads with.
     */
    public ChangeDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode a single payload into the change events it contains, in order.
     *
     * @param payload
     *            The raw payload text.
     * @return The decoded events, possibly empty.
     * @throws DecodeException
     *             If the payload is not a well-formed change document.
     */
    public List<ChangeEvent> decode(String payload) throws DecodeException {
        if (payload == null) {
            throw new DecodeException("Payload is null", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Payload is not valid JSON", payload, e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Payload is not a JSON object", payload);
        }
        JsonNode changes = root.get("change");
        if (changes == null || changes.isNull()) {
            return List.of();
        } else if (!changes.isArray()) {
            throw new DecodeException("Field 'change' is not an array", payload);
        }
        List<ChangeEvent> events = new ArrayList<>(changes.size());
        for (JsonNode change : changes) {
            events.add(decodeChange(change, payload));
        }
        return events;
    }

    private ChangeEvent decodeChange(JsonNode change, String payload) throws DecodeException {
        if (!change.isObject()) {
            throw new DecodeException("Change record is not a JSON object", payload);
        }
        JsonNode kind = change.get("kind");
        if (kind == null || !kind.isTextual()) {
            throw new DecodeException("Change record has no 'kind'", payload);
        }
        Map<String, JsonNode> columns = new LinkedHashMap<>();
        JsonNode values = change.get("columnvalues");
        if (values != null && !values.isNull()) {
            readColumns(columns, change.get("columnnames"), values, payload);
        } else {
            JsonNode oldKeys = change.get("oldkeys");
            if (oldKeys != null && oldKeys.isObject()) {
                readColumns(columns, oldKeys.get("keynames"), oldKeys.get("keyvalues"), payload);
            }
        }
        return new ChangeEvent(ChangeKind.fromString(kind.asText()), textOrNull(change.get("schema")),
                textOrNull(change.get("table")), columns);
    }

    private static void readColumns(Map<String, JsonNode> columns, JsonNode names, JsonNode values, String payload)
            throws DecodeException {
        if (values == null || !values.isArray()) {
            throw new DecodeException("Column values are not an array", payload);
        }
        if (names == null || names.isNull()) {
            // Name/value pairs.
            for (JsonNode column : values) {
                JsonNode name = column.get("name");
                if (!column.isObject() || name == null || !name.isTextual()) {
                    throw new DecodeException("Column value has no 'name'", payload);
                }
                columns.put(name.asText(), column.path("value"));
            }
        } else {
            // Parallel arrays of names and values.
            if (!names.isArray() || names.size() != values.size()) {
                throw new DecodeException("Column names do not match column values", payload);
            }
            Iterator<JsonNode> valueIter = values.elements();
            for (JsonNode name : names) {
                columns.put(name.asText(), valueIter.next());
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
