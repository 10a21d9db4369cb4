package com.birdschema.introspect;

import com.birdschema.config.JdbcTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens the single connection an export run works on. The caller closes it
 * with try-with-resources.
 */
public class ConnectionProvider {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProvider.class);

    public Connection open(JdbcTarget target) {
        logger.info("Connecting to Postgres database at {}", target);
        try {
            Connection conn = DriverManager.getConnection(target.url(), target.properties());
            try {
                conn.setReadOnly(true);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            return conn;
        } catch (SQLException e) {
            throw new DatabaseConnectionException(
                    "Could not connect to " + target + ": " + e.getMessage(), e);
        }
    }
}
