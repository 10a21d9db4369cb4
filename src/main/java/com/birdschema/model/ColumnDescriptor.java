package com.birdschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One column of an exported table. {@code description} is left empty for
 * later manual annotation.
 */
@JsonPropertyOrder({"name", "type", "is_primary_key", "foreign_keys", "description", "value_samples"})
public record ColumnDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("is_primary_key") boolean primaryKey,
        @JsonProperty("foreign_keys") List<ForeignKeyRef> foreignKeys,
        @JsonProperty("description") String description,
        @JsonProperty("value_samples") List<String> valueSamples
) {
    public ColumnDescriptor {
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        valueSamples = valueSamples == null ? List.of() : List.copyOf(valueSamples);
        description = description == null ? "" : description;
    }
}
