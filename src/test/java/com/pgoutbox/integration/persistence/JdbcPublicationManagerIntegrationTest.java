package com.pgoutbox.integration.persistence;

import com.pgoutbox.adapter.out.persistence.JdbcPublicationManager;
import com.pgoutbox.adapter.out.persistence.JdbcTableConformityManager;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.SchemaConflictException;
import com.pgoutbox.integration.base.PostgresTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@EnabledIf("isDockerAvailable")
@DisplayName("JdbcPublicationManager")
class JdbcPublicationManagerIntegrationTest extends PostgresTestBase {

    private static final String SCHEMA = "it_publication";
    private static final String PUBLICATION = "it_publication_pub";

    private JdbcPublicationManager manager;
    private TableDescriptor table;

    @BeforeEach
    void setUp() {
        manager = new JdbcPublicationManager(jdbcTemplate);
        manager.dropPublication(PUBLICATION);
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + SCHEMA + " CASCADE");
        table = TableDescriptor.defaults().withSchema(SCHEMA).withName("events");
        new JdbcTableConformityManager(jdbcTemplate).ensureTable(table);
    }

    @AfterEach
    void tearDown() {
        manager.dropPublication(PUBLICATION);
        jdbcTemplate.execute("DROP SCHEMA IF EXISTS " + SCHEMA + " CASCADE");
    }

    @Test
    @DisplayName("Creates an insert-only publication for the outbox table")
    void createsInsertOnlyPublication() {
        // When
        manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of("a"), false));

        // Then
        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT pubinsert, pubupdate, pubdelete, pubtruncate FROM pg_publication WHERE pubname = ?", PUBLICATION);
        assertEquals(true, row.get("pubinsert"));
        assertEquals(false, row.get("pubupdate"));
        assertEquals(false, row.get("pubdelete"));
        assertEquals(false, row.get("pubtruncate"));
        assertEquals("events", jdbcTemplate.queryForObject(
            "SELECT tablename FROM pg_publication_tables WHERE pubname = ?", String.class, PUBLICATION));
    }

    @Test
    @DisplayName("Accepts an existing conforming publication")
    void acceptsExisting() {
        PublicationSpec spec = new PublicationSpec(PUBLICATION, table, Set.of("a"), false);
        manager.ensurePublication(spec);

        assertDoesNotThrow(() -> manager.ensurePublication(spec));
    }

    @Test
    @DisplayName("Rejects a publication covering another table")
    void rejectsOtherTable() {
        jdbcTemplate.execute("CREATE TABLE " + SCHEMA + ".other (id int PRIMARY KEY)");
        jdbcTemplate.execute("CREATE PUBLICATION " + PUBLICATION + " FOR TABLE " + SCHEMA + ".other");

        assertThrows(SchemaConflictException.class,
            () -> manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of(), false)));
    }

    @Test
    @DisplayName("Rejects a publication for all tables")
    void rejectsAllTables() {
        jdbcTemplate.execute("CREATE PUBLICATION " + PUBLICATION + " FOR ALL TABLES");

        assertThrows(SchemaConflictException.class,
            () -> manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of(), false)));
    }

    @Test
    @DisplayName("Rejects a publication on the outbox table that does not publish inserts")
    void rejectsPublicationWithoutInserts() {
        // Given
        jdbcTemplate.execute("CREATE PUBLICATION " + PUBLICATION + " FOR TABLE " + SCHEMA + ".events"
            + " WITH (publish = 'update, delete')");

        // When
        SchemaConflictException e = assertThrows(SchemaConflictException.class,
            () -> manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of("a"), false)));

        // Then
        assertTrue(e.getMessage().contains("does not publish inserts"));
        assertEquals(false, jdbcTemplate.queryForObject(
            "SELECT pubinsert FROM pg_publication WHERE pubname = ?", Boolean.class, PUBLICATION));
    }

    @Test
    @DisplayName("Keeps the row filter in step with the registered discriminators")
    void updatesRowFilter() {
        manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of("user.created.v1"), true));
        assertTrue(rowFilter().contains("user.created.v1"));

        manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of("user.created.v1", "user.deleted.v1"), true));
        assertTrue(rowFilter().contains("user.deleted.v1"));

        manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of("user.created.v1"), false));
        assertNull(rowFilter());
    }

    @Test
    @DisplayName("Dropping is idempotent")
    void dropIsIdempotent() {
        manager.ensurePublication(new PublicationSpec(PUBLICATION, table, Set.of(), false));

        manager.dropPublication(PUBLICATION);
        manager.dropPublication(PUBLICATION);

        assertEquals(0, jdbcTemplate.queryForObject(
            "SELECT count(*) FROM pg_publication WHERE pubname = ?", Integer.class, PUBLICATION));
    }

    private String rowFilter() {
        return jdbcTemplate.queryForObject(
            "SELECT rowfilter FROM pg_publication_tables WHERE pubname = ?", String.class, PUBLICATION);
    }
}
