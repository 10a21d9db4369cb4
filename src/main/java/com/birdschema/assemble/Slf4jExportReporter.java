package com.birdschema.assemble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Slf4jExportReporter implements ExportReporter {
    private static final Logger logger = LoggerFactory.getLogger(Slf4jExportReporter.class);

    @Override
    public void caseInsensitiveMatch(String dbId, String requested, String resolved) {
        logger.warn("[{}] Table '{}' not found, using case-insensitive match '{}'", dbId, requested, resolved);
    }

    @Override
    public void tableSkipped(String dbId, String requested) {
        logger.warn("[{}] Table '{}' not found in Postgres, skipping", dbId, requested);
    }
}
