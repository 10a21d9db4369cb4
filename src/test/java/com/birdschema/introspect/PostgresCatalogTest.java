package com.birdschema.introspect;

import com.birdschema.SchemaExportService;
import com.birdschema.assemble.ExportReporter;
import com.birdschema.config.ConnectionStrings;
import com.birdschema.config.JdbcTarget;
import com.birdschema.manifest.ManifestEntry;
import com.birdschema.model.ColumnDescriptor;
import com.birdschema.model.DatabaseRecord;
import com.birdschema.model.ForeignKeyRef;
import com.birdschema.model.SchemaDocument;
import com.birdschema.model.TableRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
class PostgresCatalogTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("bird")
            .withUsername("bird")
            .withPassword("bird");

    private Connection conn;
    private PostgresCatalog catalog;

    @BeforeAll
    static void loadFixture() throws Exception {
        String ddl = new String(
                PostgresCatalogTest.class.getResourceAsStream("/bird-fixture.sql").readAllBytes()
        );

        try (Connection conn = DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
             Statement stmt = conn.createStatement()) {
            for (String sql : ddl.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
                    stmt.execute(trimmed);
                }
            }
        }
    }

    @BeforeEach
    void connect() throws Exception {
        conn = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        catalog = new PostgresCatalog(conn);
    }

    @AfterEach
    void close() throws Exception {
        conn.close();
    }

    @Test
    void listsPublicTablesSorted() {
        assertEquals(List.of("Customers", "Order Details", "empty_table", "fuel_cards", "gasstations",
                        "order_lines", "orders", "shipments", "station_codes", "transactions_1k"),
                catalog.listTables());
    }

    @Test
    void primaryKeysAreScopedToTheSchema() {
        assertEquals(Set.of("CustomerID"), catalog.primaryKeyColumns("Customers"));
        assertEquals(Set.of("order_id", "line_no"), catalog.primaryKeyColumns("order_lines"));
        // other.orders has a primary key, public.orders does not
        assertTrue(catalog.primaryKeyColumns("orders").isEmpty());
        assertEquals(Set.of("id"), new PostgresCatalog(conn, "other").primaryKeyColumns("orders"));
    }

    @Test
    void foreignKeysMapSourceColumnsToTargets() {
        Map<String, List<ForeignKeyRef>> fks = catalog.foreignKeysByColumn("transactions_1k");

        assertEquals(List.of(new ForeignKeyRef("Customers", "CustomerID")), fks.get("CustomerID"));
        assertEquals(List.of(new ForeignKeyRef("gasstations", "GasStationID")), fks.get("GasStationID"));
        assertFalse(fks.containsKey("TransactionID"));
    }

    @Test
    void compositeForeignKeyPairsColumnsByPosition() {
        Map<String, List<ForeignKeyRef>> fks = catalog.foreignKeysByColumn("shipments");

        assertEquals(List.of(new ForeignKeyRef("order_lines", "order_id")), fks.get("order_id"));
        assertEquals(List.of(new ForeignKeyRef("order_lines", "line_no")), fks.get("line_no"));
    }

    @Test
    void foreignKeyOnUniqueIndexIsKept() {
        Map<String, List<ForeignKeyRef>> fks = catalog.foreignKeysByColumn("fuel_cards");

        assertEquals(List.of(new ForeignKeyRef("station_codes", "code")), fks.get("station_code"));
    }

    @Test
    void columnsComeInDeclarationOrder() {
        List<CatalogColumn> columns = catalog.columns("orders");

        assertEquals(List.of("id", "name", "created_at"), columns.stream().map(CatalogColumn::name).toList());
        assertEquals("character varying", columns.get(1).dataType());
        assertEquals("timestamp without time zone", columns.get(2).dataType());
    }

    @Test
    void samplesSkipNullsAndRespectTheLimit() {
        assertEquals(5, catalog.sampleValues("transactions_1k", "TransactionID", 5).size());
        assertFalse(catalog.sampleValues("transactions_1k", "Amount", 5).contains(null));
        assertEquals(List.of("SME", "LAM", "KAM"), catalog.sampleValues("Customers", "Segment", 5));
        assertTrue(catalog.sampleValues("empty_table", "id", 5).isEmpty());
    }

    @Test
    void samplingQuotesAwkwardIdentifiers() {
        assertEquals(List.of("drop table orders"), catalog.sampleValues("Order Details", "select", 5));
        assertEquals(List.of("2"), catalog.sampleValues("Order Details", "from", 5));
    }

    @Test
    void unknownTableFailsSampling() {
        assertThrows(SchemaIntrospectionException.class,
                () -> catalog.sampleValues("ghost_table", "id", 5));
    }

    @Test
    void exportsManifestEndToEnd() {
        List<String> warnings = new ArrayList<>();
        ExportReporter reporter = new ExportReporter() {
            @Override
            public void caseInsensitiveMatch(String dbId, String requested, String resolved) {
                warnings.add("case:" + requested + "->" + resolved);
            }

            @Override
            public void tableSkipped(String dbId, String requested) {
                warnings.add("skip:" + requested);
            }
        };
        Properties props = new Properties();
        props.setProperty("user", postgres.getUsername());
        props.setProperty("password", postgres.getPassword());
        JdbcTarget target = new JdbcTarget(postgres.getJdbcUrl(), props);

        SchemaDocument document = new SchemaExportService(new ConnectionProvider(), reporter).export(
                List.of(new ManifestEntry("debit_card_specializing",
                        List.of("customers", "transactions_1k", "ghost_table", "orders"))),
                target, PostgresCatalog.DEFAULT_SCHEMA);

        DatabaseRecord db = document.database("debit_card_specializing");
        assertEquals(List.of("Customers", "transactions_1k", "orders"), List.copyOf(db.tables().keySet()));
        assertEquals(List.of("case:customers->Customers", "skip:ghost_table"), warnings);

        TableRecord customers = db.tables().get("Customers");
        assertEquals("Customers", customers.name());
        ColumnDescriptor customerId = customers.columns().get(0);
        assertTrue(customerId.primaryKey());
        assertEquals("INTEGER", customerId.type());

        ColumnDescriptor amount = db.tables().get("transactions_1k").columns().get(3);
        assertEquals("Amount", amount.name());
        assertEquals("NUMERIC", amount.type());
        assertTrue(amount.valueSamples().size() <= 5);
        assertFalse(amount.primaryKey());
    }

    @Test
    void unreachableDatabaseIsAConnectionError() {
        JdbcTarget target = ConnectionStrings.toJdbcTarget(
                "postgresql://bird:wrong@" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/bird");

        assertThrows(DatabaseConnectionException.class, () -> new ConnectionProvider().open(target));
    }
}
