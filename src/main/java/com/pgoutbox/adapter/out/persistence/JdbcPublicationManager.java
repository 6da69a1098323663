package com.pgoutbox.adapter.out.persistence;

import com.pgoutbox.application.port.out.PublicationManager;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.ConfigurationException;
import com.pgoutbox.infrastructure.exception.SchemaConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class JdbcPublicationManager implements PublicationManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcPublicationManager.class);

    private static final int ROW_FILTER_MIN_VERSION = 150000;
    private static final Pattern QUOTED_LITERAL = Pattern.compile("'((?:[^']|'')*)'");

    private final JdbcTemplate jdbc;

    public JdbcPublicationManager(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void ensurePublication(PublicationSpec publication) {
        Optional<String> rowFilter = publication.rowFilter();
        boolean rowFiltersSupported = serverVersion() >= ROW_FILTER_MIN_VERSION;
        if (rowFilter.isPresent() && !rowFiltersSupported) {
            throw new ConfigurationException("Filtering publication " + publication.name()
                + " by discriminator requires PostgreSQL 15 or later");
        }

        List<PublishFlags> existing = jdbc.query(
            "SELECT puballtables, pubinsert FROM pg_publication WHERE pubname = ?",
            (rs, rowNum) -> new PublishFlags(rs.getBoolean("puballtables"), rs.getBoolean("pubinsert")),
            publication.name()
        );
        if (existing.isEmpty()) {
            jdbc.execute("CREATE PUBLICATION " + publication.quotedName() + " FOR TABLE " + tableClause(publication)
                + " WITH (publish = 'insert')");
            log.info("Created publication {} for {}{}", publication.name(), publication.table(),
                rowFilter.map(f -> " where " + f).orElse(""));
            return;
        }

        PublishFlags flags = existing.get(0);
        if (flags.allTables()) {
            throw new SchemaConflictException("Publication " + publication.name()
                + " publishes all tables, expected only " + publication.table());
        }
        if (!flags.inserts()) {
            throw new SchemaConflictException("Publication " + publication.name()
                + " does not publish inserts, outbox rows would never be streamed");
        }

        List<PublishedTable> tables = jdbc.query(
            "SELECT schemaname, tablename FROM pg_publication_tables WHERE pubname = ?",
            (rs, rowNum) -> new PublishedTable(rs.getString("schemaname"), rs.getString("tablename")),
            publication.name()
        );
        TableDescriptor table = publication.table();
        if (tables.size() != 1 || !table.matches(tables.get(0).schema(), tables.get(0).name())) {
            throw new SchemaConflictException("Publication " + publication.name() + " targets " + tables
                + ", expected only " + table);
        }

        if (rowFiltersSupported && !filterMatches(publication)) {
            jdbc.execute("ALTER PUBLICATION " + publication.quotedName() + " SET TABLE " + tableClause(publication));
            log.info("Updated row filter of publication {} to {}", publication.name(), rowFilter.orElse("<none>"));
            return;
        }
        log.debug("Publication {} conforms", publication.name());
    }

    @Override
    public void dropPublication(String name) {
        jdbc.execute("DROP PUBLICATION IF EXISTS " + TableDescriptor.quote(name));
        log.info("Dropped publication {}", name);
    }

    private boolean filterMatches(PublicationSpec publication) {
        List<String> filters = jdbc.queryForList(
            "SELECT rowfilter FROM pg_publication_tables WHERE pubname = ?",
            String.class,
            publication.name()
        );
        String current = filters.isEmpty() ? null : filters.get(0);
        if (publication.rowFilter().isEmpty()) {
            return current == null;
        }
        return current != null && literalsOf(current).equals(publication.discriminators());
    }

    // the server stores the filter in normalized form, so compare the literal values only
    static Set<String> literalsOf(String rowFilter) {
        Set<String> literals = new HashSet<>();
        Matcher matcher = QUOTED_LITERAL.matcher(rowFilter);
        while (matcher.find()) {
            literals.add(matcher.group(1).replace("''", "'"));
        }
        return literals;
    }

    private static String tableClause(PublicationSpec publication) {
        return publication.table().qualifiedName() + publication.rowFilter().map(f -> " WHERE " + f).orElse("");
    }

    private int serverVersion() {
        Integer version = jdbc.queryForObject("SELECT current_setting('server_version_num')::int", Integer.class);
        return version != null ? version : 0;
    }

    private record PublishFlags(boolean allTables, boolean inserts) {}

    private record PublishedTable(String schema, String name) {
        @Override
        public String toString() {
            return schema + "." + name;
        }
    }
}
