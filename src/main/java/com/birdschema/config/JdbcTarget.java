package com.birdschema.config;

import java.util.Properties;

/**
 * A JDBC URL plus the connection properties (user, password, driver options)
 * that go with it.
 */
public record JdbcTarget(String url, Properties properties) {

    public JdbcTarget {
        Properties copy = new Properties();
        if (properties != null) {
            copy.putAll(properties);
        }
        properties = copy;
    }

    public JdbcTarget(String url) {
        this(url, new Properties());
    }

    public String user() {
        return properties.getProperty("user");
    }

    /**
     * Printable form without the password.
     */
    @Override
    public String toString() {
        String user = user();
        return user == null ? url : url + " (user " + user + ")";
    }
}
