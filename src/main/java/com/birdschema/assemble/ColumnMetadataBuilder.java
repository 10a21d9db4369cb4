package com.birdschema.assemble;

import com.birdschema.introspect.CatalogColumn;
import com.birdschema.introspect.SchemaCatalog;
import com.birdschema.model.ColumnDescriptor;
import com.birdschema.model.ForeignKeyRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the column descriptors of one table: catalog columns in ordinal
 * order, each flagged with its primary-key membership, its foreign keys, and
 * a few sampled values.
 */
public class ColumnMetadataBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ColumnMetadataBuilder.class);

    public static final int SAMPLE_LIMIT = 5;

    private final SchemaCatalog catalog;

    public ColumnMetadataBuilder(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    public List<ColumnDescriptor> build(String table) {
        logger.debug("Processing columns for table: {}", table);

        Set<String> primaryKeys = catalog.primaryKeyColumns(table);
        Map<String, List<ForeignKeyRef>> foreignKeys = catalog.foreignKeysByColumn(table);

        List<ColumnDescriptor> columns = new ArrayList<>();
        for (CatalogColumn column : catalog.columns(table)) {
            List<String> samples = catalog.sampleValues(table, column.name(), SAMPLE_LIMIT);

            columns.add(new ColumnDescriptor(
                    column.name(),
                    column.dataType().toUpperCase(Locale.ROOT),
                    primaryKeys.contains(column.name()),
                    foreignKeys.getOrDefault(column.name(), List.of()),
                    "",
                    samples.size() > SAMPLE_LIMIT ? samples.subList(0, SAMPLE_LIMIT) : samples
            ));
        }
        return columns;
    }
}
