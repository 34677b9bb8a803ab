package com.mini.csvtools.schema;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema、Row 与 DataType 基本行为测试
 */
public class SchemaTest {

    @Test
    void testSchemaValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Schema(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> Schema.of("id", "id"));
        assertThrows(IllegalArgumentException.class, () -> Schema.of("id", null));
    }

    @Test
    void testSchemaLookup() {
        Schema schema = Schema.of("id", "name", "age");

        assertEquals(3, schema.size());
        assertEquals(1, schema.indexOf("name"));
        assertEquals(-1, schema.indexOf("missing"));
        assertTrue(schema.contains("age"));
        assertEquals(Arrays.asList("age", "id"), schema.select(Arrays.asList("age", "id")).getColumns());
        assertThrows(IllegalArgumentException.class, () -> schema.select(Collections.singletonList("missing")));
    }

    @Test
    void testRowAccess() {
        Schema schema = Schema.of("id", "name");
        Row row = Row.of(7L, "seven");

        assertEquals(7L, row.get(schema, "id"));
        assertEquals("seven", row.get(schema, "name"));
        assertNull(row.get(schema, "missing"));
        assertNull(row.getValue(5));
        assertEquals(Row.of(7L, "seven"), row);
    }

    @Test
    void testRowIsImmutable() {
        Object[] values = {1L, "a"};
        Row row = new Row(values);
        values[0] = 99L;
        row.getValues()[1] = "changed";

        assertEquals(Row.of(1L, "a"), row);
    }

    @Test
    void testDataTypes() {
        assertNull(DataType.of(null));
        assertEquals(DataType.LONG, DataType.of(3L));
        assertEquals(DataType.DOUBLE, DataType.of(3.5));
        assertEquals(DataType.STRING, DataType.of("3"));

        assertEquals(DataType.DOUBLE, DataType.LONG.widen(DataType.DOUBLE));
        assertNull(DataType.LONG.widen(DataType.STRING));
        assertFalse(DataType.DOUBLE.conflictsWith(1L));
        assertFalse(DataType.LONG.conflictsWith(null));
        assertTrue(DataType.LONG.conflictsWith("abc"));
    }
}
