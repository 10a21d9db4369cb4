package com.birdschema.introspect;

/**
 * A column as declared in the catalog, before enrichment.
 */
public record CatalogColumn(
        String name,
        String dataType,
        int ordinalPosition
) {}
