package com.birdschema.cli;

import com.birdschema.BirdSchemaCli;
import com.birdschema.SchemaExportException;
import com.birdschema.SchemaExportService;
import com.birdschema.assemble.Slf4jExportReporter;
import com.birdschema.config.ConnectionSettings;
import com.birdschema.config.JdbcTarget;
import com.birdschema.introspect.ConnectionProvider;
import com.birdschema.introspect.PostgresCatalog;
import com.birdschema.manifest.ManifestEntry;
import com.birdschema.manifest.ManifestReader;
import com.birdschema.model.SchemaDocument;
import com.birdschema.output.SchemaWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "export",
        description = "Export the Postgres schema of the tables listed in dev_tables.json. "
                + "Requires the BIRD Postgres server to be running.",
        mixinStandardHelpOptions = true,
        version = BirdSchemaCli.VERSION
)
public class ExportCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ExportCommand.class);

    @Option(names = {"--dev-tables-filepath"}, defaultValue = "minidev/MINIDEV/dev_tables.json",
            description = "Path to dev_tables.json (default: ${DEFAULT-VALUE})")
    private Path devTablesFile;

    @Option(names = {"--output-filepath"}, defaultValue = "bird_mini_dev_postgres-schema.json",
            description = "Output JSON path (default: ${DEFAULT-VALUE})")
    private Path outputFile;

    @Option(names = {"--pg-conn-str"},
            description = "Postgres connection string (overrides the "
                    + ConnectionSettings.ENV_VAR + " environment variable)")
    private String connectionString;

    @Option(names = {"--schema", "-s"}, defaultValue = PostgresCatalog.DEFAULT_SCHEMA,
            description = "Schema to export (default: ${DEFAULT-VALUE})")
    private String schema;

    private final Map<String, String> environment;
    private final SchemaExportService exportService;
    private final ManifestReader manifestReader;
    private final SchemaWriter schemaWriter;

    public ExportCommand() {
        this(System.getenv(), new SchemaExportService(new ConnectionProvider(), new Slf4jExportReporter()));
    }

    public ExportCommand(Map<String, String> environment, SchemaExportService exportService) {
        this.environment = environment;
        this.exportService = exportService;
        this.manifestReader = new ManifestReader();
        this.schemaWriter = new SchemaWriter();
    }

    @Override
    public Integer call() {
        logger.info("Starting schema export");
        try {
            JdbcTarget target = ConnectionSettings.resolve(connectionString, environment);
            List<ManifestEntry> manifest = manifestReader.read(devTablesFile);

            SchemaDocument document = exportService.export(manifest, target, schema);

            schemaWriter.write(document, outputFile);
            return 0;
        } catch (SchemaExportException e) {
            logger.error("Schema export failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
