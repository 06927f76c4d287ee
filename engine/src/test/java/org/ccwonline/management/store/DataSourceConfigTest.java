package org.ccwonline.management.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataSourceConfig Tests")
class DataSourceConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(DataSourceConfig.FETCH_SIZE_KEY);
        ConnectionFactory.clearCache();
    }

    @Test
    @DisplayName("Settings load from a classpath resource")
    void testLoad() {
        DataSourceConfig config = DataSourceConfig.load("datasource-test.properties");
        assertEquals("jdbc:sqlite::memory:", config.url());
        assertEquals("reporter", config.user());
        assertEquals(250, config.fetchSize());
        assertTrue(config.isInMemory());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    @DisplayName("A missing resource yields in-memory DuckDB")
    void testDefaults() {
        DataSourceConfig config = DataSourceConfig.load("no-such-file.properties");
        assertEquals(DataSourceConfig.inMemory(), config);
    }

    @Test
    @DisplayName("System properties override the file")
    void testOverride() {
        System.setProperty(DataSourceConfig.FETCH_SIZE_KEY, "10");
        assertEquals(10, DataSourceConfig.load("datasource-test.properties").fetchSize());
    }

    @Test
    @DisplayName("Invalid settings are rejected")
    void testInvalid() {
        Properties properties = new Properties();
        properties.setProperty(DataSourceConfig.FETCH_SIZE_KEY, "many");
        assertThrows(IllegalArgumentException.class, () -> DataSourceConfig.fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> DataSourceConfig.of("duckdb"));
        assertThrows(IllegalArgumentException.class, () -> new DataSourceConfig("jdbc:duckdb:", null, null, -1));
    }

    @Test
    @DisplayName("In-memory connections are shared until the cache is cleared")
    void testConnectionCache() throws SQLException {
        ConnectionFactory factory = new ConnectionFactory(DataSourceConfig.inMemory());
        Connection first = factory.open();
        assertSame(first, factory.open());
        ConnectionFactory.clearCache();
        assertTrue(first.isClosed());
        assertNotSame(first, factory.open());
    }
}
