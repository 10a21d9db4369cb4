package com.birdschema;

import com.birdschema.assemble.ExportReporter;
import com.birdschema.assemble.SchemaAssembler;
import com.birdschema.config.JdbcTarget;
import com.birdschema.introspect.ConnectionProvider;
import com.birdschema.introspect.DatabaseConnectionException;
import com.birdschema.introspect.PostgresCatalog;
import com.birdschema.manifest.ManifestEntry;
import com.birdschema.model.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Runs one export: opens the connection, assembles the document for the
 * manifest, and closes the connection on every path.
 */
public class SchemaExportService {
    private static final Logger logger = LoggerFactory.getLogger(SchemaExportService.class);

    private final ConnectionProvider connectionProvider;
    private final ExportReporter reporter;

    public SchemaExportService(ConnectionProvider connectionProvider, ExportReporter reporter) {
        this.connectionProvider = connectionProvider;
        this.reporter = reporter;
    }

    public SchemaDocument export(List<ManifestEntry> manifest, JdbcTarget target, String schema) {
        SchemaDocument document;
        try (Connection conn = connectionProvider.open(target)) {
            document = new SchemaAssembler(new PostgresCatalog(conn, schema), reporter).assemble(manifest);
        } catch (SQLException e) {
            throw new DatabaseConnectionException("Failed to close connection: " + e.getMessage(), e);
        }
        logger.info("Postgres connection closed");
        logger.info("Assembled schema for {} databases", document.databases().size());
        return document;
    }
}
