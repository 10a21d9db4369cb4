package com.birdschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"target_table", "target_column"})
public record ForeignKeyRef(
        @JsonProperty("target_table") String targetTable,
        @JsonProperty("target_column") String targetColumn
) {}
