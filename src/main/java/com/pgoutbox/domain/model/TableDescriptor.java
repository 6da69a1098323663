package com.pgoutbox.domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Schema of the outbox table: where it lives and which column plays which role.
 * Immutable; the engine never touches a table it was not described.
 */
public record TableDescriptor(
    String schema,
    String name,
    ColumnDescriptor id,
    ColumnDescriptor discriminator,
    ColumnDescriptor payload,
    ColumnDescriptor createdAt
) {

    public static final String DEFAULT_SCHEMA = "public";
    public static final String DEFAULT_NAME = "outbox";

    public TableDescriptor {
        requireIdentifier(schema, "schema");
        requireIdentifier(name, "table name");
        Objects.requireNonNull(id, "id column");
        Objects.requireNonNull(discriminator, "discriminator column");
        Objects.requireNonNull(payload, "payload column");
        Objects.requireNonNull(createdAt, "createdAt column");

        Set<String> names = new HashSet<>();
        for (ColumnDescriptor column : List.of(id, discriminator, payload, createdAt)) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("Column " + column.name() + " is assigned to more than one role");
            }
        }
    }

    public static TableDescriptor defaults() {
        return new TableDescriptor(
            DEFAULT_SCHEMA,
            DEFAULT_NAME,
            new ColumnDescriptor("id", "uuid"),
            new ColumnDescriptor("message_type", "varchar(250)"),
            new ColumnDescriptor("data", "jsonb"),
            new ColumnDescriptor("created_at", "timestamptz")
        );
    }

    public TableDescriptor withSchema(String schema) {
        return new TableDescriptor(schema, name, id, discriminator, payload, createdAt);
    }

    public TableDescriptor withName(String name) {
        return new TableDescriptor(schema, name, id, discriminator, payload, createdAt);
    }

    public TableDescriptor withColumns(String idName, String discriminatorName, String payloadName, String createdAtName) {
        return new TableDescriptor(
            schema,
            name,
            id.renamed(idName),
            discriminator.renamed(discriminatorName),
            payload.renamed(payloadName),
            createdAt.renamed(createdAtName)
        );
    }

    public List<ColumnDescriptor> columns() {
        return List.of(id, discriminator, payload, createdAt);
    }

    public String qualifiedName() {
        return quote(schema) + "." + quote(name);
    }

    public boolean matches(String schemaName, String tableName) {
        return schema.equals(schemaName) && name.equals(tableName);
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }

    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Outbox " + what + " cannot be empty");
        }
    }

    /**
     * A column of the outbox table. {@code sqlType} is the DDL type used on creation,
     * {@link #baseType()} the normalized type name used for conformity checks.
     */
    public record ColumnDescriptor(String name, String sqlType) {

        public ColumnDescriptor {
            requireIdentifier(name, "column name");
            requireIdentifier(sqlType, "column type");
        }

        public ColumnDescriptor renamed(String newName) {
            return newName == null || newName.isBlank() ? this : new ColumnDescriptor(newName, sqlType);
        }

        public String quotedName() {
            return quote(name);
        }

        public String baseType() {
            String type = sqlType.toLowerCase(Locale.ROOT).trim();
            int paren = type.indexOf('(');
            if (paren > 0) {
                type = type.substring(0, paren).trim();
            }
            return switch (type) {
                case "character varying" -> "varchar";
                case "timestamp with time zone" -> "timestamptz";
                case "timestamp without time zone" -> "timestamp";
                case "bigint", "bigserial" -> "int8";
                case "integer", "serial" -> "int4";
                default -> type;
            };
        }
    }
}
