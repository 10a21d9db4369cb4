package com.birdschema.assemble;

import com.birdschema.model.TableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TableAssembler {
    private static final Logger logger = LoggerFactory.getLogger(TableAssembler.class);

    private final ColumnMetadataBuilder columnBuilder;

    public TableAssembler(ColumnMetadataBuilder columnBuilder) {
        this.columnBuilder = columnBuilder;
    }

    public TableRecord assemble(String table) {
        logger.debug("Building schema for table: {}", table);
        return TableRecord.of(table, columnBuilder.build(table));
    }
}
