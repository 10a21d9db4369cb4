package com.birdschema.introspect;

/**
 * Catalog queries against PostgreSQL's information schema.
 *
 * Every query takes the target schema as its first parameter; the per-table
 * queries take the table name as the second. Results come back in
 * deterministic order.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    public static final String TABLES = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = ?
            ORDER BY table_name
            """;

    public static final String COLUMNS = """
            SELECT column_name,
                   data_type,
                   ordinal_position
            FROM information_schema.columns
            WHERE table_schema = ?
              AND table_name = ?
            ORDER BY ordinal_position
            """;

    public static final String PRIMARY_KEY_COLUMNS = """
            SELECT kcu.column_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            WHERE tc.constraint_type = 'PRIMARY KEY'
              AND tc.table_schema = ?
              AND tc.table_name = ?
            ORDER BY kcu.ordinal_position
            """;

    /**
     * Targets come from the referenced unique constraint, paired by position.
     * A foreign key on a bare unique index has no such constraint; its
     * targets fall back to {@code constraint_column_usage}.
     */
    public static final String FOREIGN_KEYS = """
            SELECT kcu.column_name AS source_column,
                   COALESCE(pku.table_name, ccu.table_name) AS target_table,
                   COALESCE(pku.column_name, ccu.column_name) AS target_column
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
             AND tc.table_name = kcu.table_name
            JOIN information_schema.referential_constraints rc
              ON rc.constraint_name = tc.constraint_name
             AND rc.constraint_schema = tc.table_schema
            LEFT JOIN information_schema.key_column_usage pku
              ON pku.constraint_name = rc.unique_constraint_name
             AND pku.constraint_schema = rc.unique_constraint_schema
             AND pku.ordinal_position = kcu.position_in_unique_constraint
            LEFT JOIN information_schema.constraint_column_usage ccu
              ON rc.unique_constraint_name IS NULL
             AND ccu.constraint_name = tc.constraint_name
             AND ccu.constraint_schema = tc.table_schema
            WHERE tc.constraint_type = 'FOREIGN KEY'
              AND tc.table_schema = ?
              AND tc.table_name = ?
              AND COALESCE(pku.column_name, ccu.column_name) IS NOT NULL
            ORDER BY tc.constraint_name, kcu.ordinal_position
            """;

    /**
     * Builds the sampling query for one column. Both identifiers must already
     * be quoted by the driver.
     */
    public static String sampleValues(String quotedSchema, String quotedTable, String quotedColumn) {
        return "SELECT " + quotedColumn
                + " FROM " + quotedSchema + "." + quotedTable
                + " WHERE " + quotedColumn + " IS NOT NULL"
                + " LIMIT ?";
    }
}
