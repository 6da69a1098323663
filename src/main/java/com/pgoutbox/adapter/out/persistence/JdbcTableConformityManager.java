package com.pgoutbox.adapter.out.persistence;

import com.pgoutbox.application.port.out.TableConformityManager;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.domain.model.TableDescriptor.ColumnDescriptor;
import com.pgoutbox.infrastructure.exception.SchemaConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public class JdbcTableConformityManager implements TableConformityManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcTableConformityManager.class);

    // types that are interchangeable for the role a column plays
    private static final List<Set<String>> COMPATIBLE_TYPES = List.of(
        Set.of("varchar", "text", "bpchar"),
        Set.of("jsonb", "json"),
        Set.of("timestamptz", "timestamp")
    );

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public JdbcTableConformityManager(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(
            new DataSourceTransactionManager(Objects.requireNonNull(jdbc.getDataSource(), "dataSource")));
    }

    @Override
    public EnsureOutcome ensureTable(TableDescriptor table) {
        Map<String, String> existing = readColumns(table);
        if (existing.isEmpty()) {
            createTable(table);
            return EnsureOutcome.CREATED;
        }

        for (ColumnDescriptor column : table.columns()) {
            String actual = existing.get(column.name());
            if (actual == null) {
                throw new SchemaConflictException("Outbox table " + table + " has no column " + column.name());
            }
            if (!compatible(column.baseType(), actual)) {
                throw new SchemaConflictException("Column " + column.name() + " of outbox table " + table
                    + " has type " + actual + ", expected " + column.sqlType());
            }
        }

        List<String> primaryKey = readPrimaryKey(table);
        if (!primaryKey.equals(List.of(table.id().name()))) {
            throw new SchemaConflictException("Primary key of outbox table " + table + " is " + primaryKey
                + ", expected [" + table.id().name() + "]");
        }

        log.debug("Outbox table {} conforms", table);
        return EnsureOutcome.VERIFIED;
    }

    private Map<String, String> readColumns(TableDescriptor table) {
        Map<String, String> columns = new HashMap<>();
        jdbc.query("""
            SELECT column_name, udt_name
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            """,
            rs -> {
                columns.put(rs.getString("column_name"), rs.getString("udt_name"));
            },
            table.schema(),
            table.name()
        );
        return columns;
    }

    private List<String> readPrimaryKey(TableDescriptor table) {
        return jdbc.queryForList("""
            SELECT a.attname
            FROM pg_index i
            JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)
            WHERE i.indrelid = ?::regclass AND i.indisprimary
            ORDER BY a.attnum
            """,
            String.class,
            table.qualifiedName()
        );
    }

    // schema and table DDL commit together, a failing table leaves no schema behind
    private void createTable(TableDescriptor table) {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table.qualifiedName() + " ("
            + table.id().quotedName() + " " + table.id().sqlType() + " PRIMARY KEY, "
            + table.discriminator().quotedName() + " " + table.discriminator().sqlType() + " NOT NULL, "
            + table.payload().quotedName() + " " + table.payload().sqlType() + " NOT NULL, "
            + table.createdAt().quotedName() + " " + table.createdAt().sqlType() + " NOT NULL DEFAULT now())";

        transactionTemplate.executeWithoutResult(status -> {
            if (!TableDescriptor.DEFAULT_SCHEMA.equals(table.schema())) {
                jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + TableDescriptor.quote(table.schema()));
            }
            jdbc.execute(ddl);
        });
        log.info("Created outbox table {} with columns {}", table,
            table.columns().stream().map(ColumnDescriptor::name).collect(Collectors.joining(", ")));
    }

    static boolean compatible(String expected, String actual) {
        if (expected.equals(actual)) {
            return true;
        }
        return COMPATIBLE_TYPES.stream().anyMatch(family -> family.contains(expected) && family.contains(actual));
    }
}
