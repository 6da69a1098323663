package com.pgoutbox.domain.model;

import com.pgoutbox.domain.model.TableDescriptor.ColumnDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableDescriptor")
class TableDescriptorTest {

    @Test
    @DisplayName("Defaults describe public.outbox")
    void defaultsDescribePublicOutbox() {
        TableDescriptor table = TableDescriptor.defaults();

        assertEquals("public.outbox", table.toString());
        assertEquals("\"public\".\"outbox\"", table.qualifiedName());
        assertEquals("id", table.id().name());
        assertEquals("message_type", table.discriminator().name());
        assertEquals("data", table.payload().name());
        assertEquals("created_at", table.createdAt().name());
        assertTrue(table.matches("public", "outbox"));
        assertFalse(table.matches("other", "outbox"));
    }

    @Test
    @DisplayName("Renaming keeps column types and ignores blank names")
    void renamingKeepsTypes() {
        TableDescriptor table = TableDescriptor.defaults()
            .withSchema("messaging")
            .withName("events")
            .withColumns("event_id", "kind", null, " ");

        assertEquals("messaging.events", table.toString());
        assertEquals(new ColumnDescriptor("event_id", "uuid"), table.id());
        assertEquals(new ColumnDescriptor("kind", "varchar(250)"), table.discriminator());
        assertEquals("data", table.payload().name());
        assertEquals("created_at", table.createdAt().name());
    }

    @Test
    @DisplayName("Rejects a column playing two roles")
    void rejectsDuplicateColumn() {
        TableDescriptor table = TableDescriptor.defaults();

        assertThrows(IllegalArgumentException.class, () -> table.withColumns("id", "id", "data", "created_at"));
    }

    @Test
    @DisplayName("Quotes identifiers")
    void quotesIdentifiers() {
        assertEquals("\"we\"\"ird\"", TableDescriptor.quote("we\"ird"));
    }

    @Nested
    @DisplayName("ColumnDescriptor.baseType")
    class BaseTypeTests {

        @Test
        void stripsModifiers() {
            assertEquals("varchar", new ColumnDescriptor("c", "varchar(250)").baseType());
            assertEquals("numeric", new ColumnDescriptor("c", "NUMERIC(10, 2)").baseType());
        }

        @Test
        void normalizesSqlStandardNames() {
            assertEquals("varchar", new ColumnDescriptor("c", "character varying(100)").baseType());
            assertEquals("timestamptz", new ColumnDescriptor("c", "timestamp with time zone").baseType());
            assertEquals("timestamp", new ColumnDescriptor("c", "timestamp without time zone").baseType());
            assertEquals("int8", new ColumnDescriptor("c", "bigint").baseType());
            assertEquals("int4", new ColumnDescriptor("c", "integer").baseType());
            assertEquals("jsonb", new ColumnDescriptor("c", "jsonb").baseType());
        }
    }
}
