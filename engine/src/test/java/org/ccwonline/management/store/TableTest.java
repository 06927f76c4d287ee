package org.ccwonline.management.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Table Tests")
class TableTest {

    @Test
    @DisplayName("Qualified name includes the schema when present")
    void testQualifiedName() {
        List<Column> columns = List.of(Column.key("Id", SqlDataType.INTEGER));
        assertEquals("Tag", new Table("Tag", columns).qualifiedName());
        assertEquals("main.Tag", new Table("main", "Tag", columns).qualifiedName());
    }

    @Test
    @DisplayName("Column lookup ignores case")
    void testFindColumn() {
        Table table = new Table("Tag", List.of(Column.key("Id", SqlDataType.INTEGER),
                Column.nullable("Label", SqlDataType.VARCHAR)));
        assertTrue(table.findColumn("label").isPresent());
        assertTrue(table.findColumn("missing").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> table.getColumn("missing"));
    }

    @Test
    @DisplayName("Invalid definitions are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Table(" ", List.of(Column.required("A", SqlDataType.INTEGER))));
        assertThrows(IllegalArgumentException.class, () -> new Table("Empty", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Table("Twice", List.of(
                Column.key("A", SqlDataType.INTEGER), Column.key("B", SqlDataType.INTEGER))));
        assertThrows(IllegalArgumentException.class, () -> new Column("K", SqlDataType.INTEGER, true, true));
    }

    @Test
    @DisplayName("A table without a key has no key column")
    void testNoKey() {
        Table table = new Table("Log", List.of(Column.required("Line", SqlDataType.VARCHAR)));
        assertThrows(IllegalStateException.class, table::keyColumn);
    }

    @Test
    @DisplayName("Decimal and UUID columns use portable SQL types")
    void testSqlNames() {
        assertEquals("DECIMAL(28, 10)", SqlDataType.DECIMAL.sqlName());
        assertEquals("VARCHAR(36)", SqlDataType.UUID.sqlName());
        assertEquals(SqlDataType.UUID, SqlDataType.fromJavaType(java.util.UUID.class));
        assertThrows(IllegalArgumentException.class, () -> SqlDataType.fromJavaType(Object.class));
    }
}
