package org.ccwonline.management.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * JDBC connection settings.
 *
 * Loaded from {@code ccwonline.properties} on the classpath; any key can be overridden
 * by a system property of the same name.
 *
 * @param url       The JDBC URL
 * @param user      The user name, or null
 * @param password  The password, or null
 * @param fetchSize The statement fetch size, 0 for the driver default
 */
public record DataSourceConfig(String url, String user, String password, int fetchSize) {

    public static final String RESOURCE = "ccwonline.properties";
    public static final String URL_KEY = "ccwonline.jdbc.url";
    public static final String USER_KEY = "ccwonline.jdbc.user";
    public static final String PASSWORD_KEY = "ccwonline.jdbc.password";
    public static final String FETCH_SIZE_KEY = "ccwonline.fetch-size";

    public static final String DEFAULT_URL = "jdbc:duckdb:";

    public DataSourceConfig {
        Objects.requireNonNull(url, "JDBC url cannot be null");
        if (!url.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Not a JDBC url: " + url);
        }
        if (fetchSize < 0) {
            throw new IllegalArgumentException("Fetch size must be non-negative: " + fetchSize);
        }
    }

    public static DataSourceConfig of(String url) {
        return new DataSourceConfig(url, null, null, 0);
    }

    public static DataSourceConfig inMemory() {
        return of(DEFAULT_URL);
    }

    public static DataSourceConfig load() {
        return load(RESOURCE);
    }

    /**
     * @param resource The classpath resource to read; a missing resource yields the defaults
     */
    public static DataSourceConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = DataSourceConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        return fromProperties(properties);
    }

    public static DataSourceConfig fromProperties(Properties properties) {
        String url = setting(properties, URL_KEY, DEFAULT_URL);
        String user = setting(properties, USER_KEY, null);
        String password = setting(properties, PASSWORD_KEY, null);
        String fetchSize = setting(properties, FETCH_SIZE_KEY, "0");
        try {
            return new DataSourceConfig(url, user, password, Integer.parseInt(fetchSize.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + FETCH_SIZE_KEY + ": " + fetchSize, e);
        }
    }

    private static String setting(Properties properties, String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public boolean isInMemory() {
        return url.equals("jdbc:duckdb:") || url.equals("jdbc:sqlite::memory:") || url.equals("jdbc:sqlite:");
    }

    @Override
    public String toString() {
        return "DataSourceConfig[url=" + url + ", user=" + user + ", fetchSize=" + fetchSize + "]";
    }
}
