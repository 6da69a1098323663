package com.pgoutbox.integration.persistence;

import com.pgoutbox.adapter.out.persistence.JdbcTableConformityManager;
import com.pgoutbox.application.port.out.TableConformityManager.EnsureOutcome;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.SchemaConflictException;
import com.pgoutbox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
@DisplayName("JdbcTableConformityManager")
class JdbcTableConformityManagerIntegrationTest extends PostgresTestBase {

    private static final String SCHEMA = "it_conformity";

    private JdbcTableConformityManager manager;
    private TableDescriptor table;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + SCHEMA + " CASCADE");
        manager = new JdbcTableConformityManager(jdbcTemplate);
        table = TableDescriptor.defaults().withSchema(SCHEMA).withName("events");
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + SCHEMA + " CASCADE");
    }

    @Test
    @DisplayName("Creates a missing table and schema, then verifies it")
    void createsThenVerifies() {
        // When
        EnsureOutcome first = manager.ensureTable(table);
        EnsureOutcome second = manager.ensureTable(table);

        // Then
        assertEquals(EnsureOutcome.CREATED, first);
        assertEquals(EnsureOutcome.VERIFIED, second);
        List<String> columns = jdbcTemplate.queryForList(
            "SELECT column_name FROM information_schema.columns WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position",
            String.class, SCHEMA, "events");
        assertEquals(List.of("id", "message_type", "data", "created_at"), columns);
    }

    @Test
    @DisplayName("Leaves no schema behind when the table cannot be created")
    void failedCreationLeavesNothing() {
        // Given
        TableDescriptor broken = new TableDescriptor(SCHEMA, "events",
            table.id(), table.discriminator(),
            new TableDescriptor.ColumnDescriptor("data", "no_such_type"),
            table.createdAt());

        // When
        assertThrows(DataAccessException.class, () -> manager.ensureTable(broken));

        // Then
        assertEquals(0, jdbcTemplate.queryForObject(
            "SELECT count(*) FROM information_schema.schemata WHERE schema_name = ?", Integer.class, SCHEMA));
    }

    @Test
    @DisplayName("Accepts compatible column types")
    void acceptsCompatibleTypes() {
        jdbcTemplate.execute("CREATE SCHEMA " + SCHEMA);
        jdbcTemplate.execute("CREATE TABLE " + SCHEMA + ".events (id uuid PRIMARY KEY, message_type text NOT NULL, "
            + "data json NOT NULL, created_at timestamp NOT NULL, extra int)");

        assertEquals(EnsureOutcome.VERIFIED, manager.ensureTable(table));
    }

    @Test
    @DisplayName("Rejects an incompatible payload type without altering the table")
    void rejectsIncompatibleType() {
        jdbcTemplate.execute("CREATE SCHEMA " + SCHEMA);
        jdbcTemplate.execute("CREATE TABLE " + SCHEMA + ".events (id uuid PRIMARY KEY, message_type varchar(250), "
            + "data integer, created_at timestamptz)");

        SchemaConflictException e = assertThrows(SchemaConflictException.class, () -> manager.ensureTable(table));

        assertTrue(e.getMessage().contains("data"));
        String type = jdbcTemplate.queryForObject(
            "SELECT udt_name FROM information_schema.columns WHERE table_schema = ? AND table_name = 'events' AND column_name = 'data'",
            String.class, SCHEMA);
        assertEquals("int4", type);
    }

    @Test
    @DisplayName("Rejects a missing column")
    void rejectsMissingColumn() {
        jdbcTemplate.execute("CREATE SCHEMA " + SCHEMA);
        jdbcTemplate.execute("CREATE TABLE " + SCHEMA + ".events (id uuid PRIMARY KEY, message_type text, data jsonb)");

        SchemaConflictException e = assertThrows(SchemaConflictException.class, () -> manager.ensureTable(table));

        assertTrue(e.getMessage().contains("created_at"));
    }

    @Test
    @DisplayName("Rejects a table keyed on another column")
    void rejectsWrongPrimaryKey() {
        jdbcTemplate.execute("CREATE SCHEMA " + SCHEMA);
        jdbcTemplate.execute("CREATE TABLE " + SCHEMA + ".events (id uuid, message_type text PRIMARY KEY, "
            + "data jsonb, created_at timestamptz)");

        assertThrows(SchemaConflictException.class, () -> manager.ensureTable(table));
    }
}
