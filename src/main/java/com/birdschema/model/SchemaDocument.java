package com.birdschema.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-level export document: {@code db_id} to database record, in manifest order.
 * Serializes as a bare JSON object.
 */
public record SchemaDocument(Map<String, DatabaseRecord> databases) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SchemaDocument {
        databases = databases == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(databases));
    }

    @JsonValue
    public Map<String, DatabaseRecord> databases() {
        return databases;
    }

    public DatabaseRecord database(String dbId) {
        return databases.get(dbId);
    }
}
