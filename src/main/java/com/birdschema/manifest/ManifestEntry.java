package com.birdschema.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One database of the manifest: its id and the table names it expects, as
 * spelled by the manifest. Other fields of the manifest file are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestEntry(
        @JsonProperty("db_id") String dbId,
        @JsonProperty("table_names_original") List<String> tableNamesOriginal
) {
    public ManifestEntry {
        tableNamesOriginal = tableNamesOriginal == null ? List.of() : List.copyOf(tableNamesOriginal);
    }
}
