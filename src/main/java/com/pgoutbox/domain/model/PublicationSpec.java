package com.pgoutbox.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A PostgreSQL publication scoped to the outbox table.
 * {@code discriminators} mirrors the registered routing keys (wildcard excluded).
 */
public record PublicationSpec(
    String name,
    TableDescriptor table,
    Set<String> discriminators,
    boolean filterByDiscriminator
) {

    public static final String DEFAULT_NAME = "outbox_pub";

    public PublicationSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Publication name cannot be empty");
        }
        Objects.requireNonNull(table, "table");
        discriminators = Set.copyOf(Objects.requireNonNull(discriminators, "discriminators"));
    }

    /**
     * Row filter restricting the publication to the registered discriminators,
     * or empty when the publication should carry every row.
     */
    public Optional<String> rowFilter() {
        if (!filterByDiscriminator || discriminators.isEmpty()) {
            return Optional.empty();
        }
        // sorted so the generated clause is stable across restarts
        String values = new TreeSet<>(discriminators).stream()
            .map(d -> "'" + d.replace("'", "''") + "'")
            .collect(Collectors.joining(", "));
        return Optional.of("(" + table.discriminator().quotedName() + " IN (" + values + "))");
    }

    public String quotedName() {
        return TableDescriptor.quote(name);
    }
}
