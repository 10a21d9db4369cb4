package com.birdschema.introspect;

import com.birdschema.model.ForeignKeyRef;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of one database schema's catalog.
 *
 * Implementations raise {@link SchemaIntrospectionException} when a query
 * fails; callers do not recover from it.
 */
public interface SchemaCatalog {

    /**
     * All table names in the schema, sorted ascending.
     */
    List<String> listTables();

    /**
     * Columns of the primary-key constraint of {@code table}; empty if it has none.
     */
    Set<String> primaryKeyColumns(String table);

    /**
     * Foreign-key targets of {@code table}, keyed by source column. A column
     * with several foreign keys maps to all of them, in query order.
     */
    Map<String, List<ForeignKeyRef>> foreignKeysByColumn(String table);

    /**
     * Declared columns of {@code table}, in ordinal position order.
     */
    List<CatalogColumn> columns(String table);

    /**
     * At most {@code limit} non-null values of {@code table.column}, rendered as strings.
     */
    List<String> sampleValues(String table, String column, int limit);
}
