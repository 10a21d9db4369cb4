package com.birdschema.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Decides which connection string a run uses: the command-line value when one
 * is given, otherwise {@value #ENV_VAR} from the environment.
 */
public final class ConnectionSettings {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionSettings.class);

    public static final String ENV_VAR = "POSTGRES_CONNECTION_STRING";

    private ConnectionSettings() {}

    public static JdbcTarget resolve(String flagValue, Map<String, String> environment) {
        if (flagValue != null && !flagValue.isBlank()) {
            JdbcTarget target = ConnectionStrings.toJdbcTarget(flagValue);
            logger.info("Using connection string from the command line: {}", target);
            return target;
        }

        String fromEnv = environment.get(ENV_VAR);
        if (fromEnv == null || fromEnv.isBlank()) {
            throw new ConfigurationException(ENV_VAR + " is not set and no connection string was given");
        }
        JdbcTarget target = ConnectionStrings.toJdbcTarget(fromEnv);
        logger.info("Using connection string from environment variable {}: {}", ENV_VAR, target);
        return target;
    }
}
