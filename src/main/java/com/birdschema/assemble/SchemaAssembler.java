package com.birdschema.assemble;

import com.birdschema.introspect.SchemaCatalog;
import com.birdschema.manifest.ManifestEntry;
import com.birdschema.model.DatabaseRecord;
import com.birdschema.model.SchemaDocument;
import com.birdschema.model.TableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the schema document for a manifest against one live catalog.
 *
 * <p>Each manifest table name is resolved against the live table names (see
 * {@link TableNameResolver}). Names that only match ignoring case are used in
 * their live spelling; names with no match are left out. Both cases are
 * passed to the {@link ExportReporter}. Catalog failures propagate unchanged.
 */
public class SchemaAssembler {
    private static final Logger logger = LoggerFactory.getLogger(SchemaAssembler.class);

    private final SchemaCatalog catalog;
    private final TableAssembler tableAssembler;
    private final ExportReporter reporter;

    public SchemaAssembler(SchemaCatalog catalog, ExportReporter reporter) {
        this(catalog, new TableAssembler(new ColumnMetadataBuilder(catalog)), reporter);
    }

    public SchemaAssembler(SchemaCatalog catalog, TableAssembler tableAssembler, ExportReporter reporter) {
        this.catalog = catalog;
        this.tableAssembler = tableAssembler;
        this.reporter = reporter;
    }

    public SchemaDocument assemble(List<ManifestEntry> manifest) {
        List<String> liveTables = catalog.listTables();
        logger.info("Found {} tables in the live schema", liveTables.size());
        TableNameResolver resolver = new TableNameResolver(liveTables);

        Map<String, DatabaseRecord> databases = new LinkedHashMap<>();
        for (ManifestEntry entry : manifest) {
            logger.debug("Processing database: {}", entry.dbId());
            databases.put(entry.dbId(), assembleDatabase(entry, resolver));
        }
        return new SchemaDocument(databases);
    }

    private DatabaseRecord assembleDatabase(ManifestEntry entry, TableNameResolver resolver) {
        Map<String, TableRecord> tables = new LinkedHashMap<>();
        for (String requested : entry.tableNamesOriginal()) {
            TableResolution resolution = resolver.resolve(requested);
            if (!resolution.isResolved()) {
                reporter.tableSkipped(entry.dbId(), requested);
                continue;
            }
            if (resolution.kind() == TableResolution.Kind.CASE_INSENSITIVE) {
                reporter.caseInsensitiveMatch(entry.dbId(), requested, resolution.resolvedName());
            }
            String table = resolution.resolvedName();
            tables.put(table, tableAssembler.assemble(table));
        }
        return new DatabaseRecord(entry.dbId(), tables);
    }
}
