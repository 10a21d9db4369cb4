package com.birdschema.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name", "columns", "description", "table_str"})
public record TableRecord(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<ColumnDescriptor> columns,
        @JsonProperty("description") String description,
        @JsonProperty("table_str") String tableStr
) {
    public TableRecord {
        columns = columns == null ? List.of() : List.copyOf(columns);
        description = description == null ? "" : description;
        tableStr = tableStr == null ? "" : tableStr;
    }

    public static TableRecord of(String name, List<ColumnDescriptor> columns) {
        return new TableRecord(name, columns, "", "");
    }
}
