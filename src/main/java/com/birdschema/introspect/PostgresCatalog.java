package com.birdschema.introspect;

import com.birdschema.model.ForeignKeyRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link SchemaCatalog} backed by a live PostgreSQL connection.
 * Executes the queries from {@link PostgresQueries}, one at a time, on the
 * connection it is given. The connection stays owned by the caller.
 */
public class PostgresCatalog implements SchemaCatalog {
    private static final Logger logger = LoggerFactory.getLogger(PostgresCatalog.class);

    public static final String DEFAULT_SCHEMA = "public";

    private final Connection conn;
    private final String schema;

    public PostgresCatalog(Connection conn, String schema) {
        this.conn = conn;
        this.schema = schema;
    }

    public PostgresCatalog(Connection conn) {
        this(conn, DEFAULT_SCHEMA);
    }

    @Override
    public List<String> listTables() {
        logger.debug("Fetching tables of schema {}", schema);
        List<String> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.TABLES)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("table_name"));
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to list tables of schema " + schema, e);
        }
        // The database collation need not agree with String ordering.
        result.sort(null);
        return result;
    }

    @Override
    public Set<String> primaryKeyColumns(String table) {
        logger.debug("Fetching primary keys for table: {}", table);
        Set<String> result = new LinkedHashSet<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.PRIMARY_KEY_COLUMNS)) {
            stmt.setString(1, schema);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString("column_name"));
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to fetch primary keys for table " + table, e);
        }
        return result;
    }

    @Override
    public Map<String, List<ForeignKeyRef>> foreignKeysByColumn(String table) {
        logger.debug("Fetching foreign keys for table: {}", table);
        Map<String, List<ForeignKeyRef>> result = new LinkedHashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.FOREIGN_KEYS)) {
            stmt.setString(1, schema);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.computeIfAbsent(rs.getString("source_column"), k -> new ArrayList<>())
                            .add(new ForeignKeyRef(
                                    rs.getString("target_table"),
                                    rs.getString("target_column")
                            ));
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to fetch foreign keys for table " + table, e);
        }
        return result;
    }

    @Override
    public List<CatalogColumn> columns(String table) {
        List<CatalogColumn> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.COLUMNS)) {
            stmt.setString(1, schema);
            stmt.setString(2, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new CatalogColumn(
                            rs.getString("column_name"),
                            rs.getString("data_type"),
                            rs.getInt("ordinal_position")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException("Failed to fetch columns for table " + table, e);
        }
        return result;
    }

    @Override
    public List<String> sampleValues(String table, String column, int limit) {
        logger.debug("Sampling values for column: {}.{}", table, column);
        List<String> result = new ArrayList<>();
        try {
            String sql;
            try (Statement quoting = conn.createStatement()) {
                sql = PostgresQueries.sampleValues(
                        quoting.enquoteIdentifier(schema, true),
                        quoting.enquoteIdentifier(table, true),
                        quoting.enquoteIdentifier(column, true)
                );
            }
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setInt(1, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next() && result.size() < limit) {
                        String value = rs.getString(1);
                        if (value != null) {
                            result.add(value);
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new SchemaIntrospectionException(
                    "Failed to sample values for column " + table + "." + column, e);
        }
        return result;
    }
}
