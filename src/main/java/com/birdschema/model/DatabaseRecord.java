package com.birdschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A manifest database and the tables that resolved against the live schema,
 * keyed by resolved table name in manifest order.
 */
@JsonPropertyOrder({"name", "tables"})
public record DatabaseRecord(
        @JsonProperty("name") String name,
        @JsonProperty("tables") Map<String, TableRecord> tables
) {
    public DatabaseRecord {
        tables = tables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }
}
