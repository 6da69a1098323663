package com.pgoutbox.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A decoded logical replication message. Only the shapes the engine acts on are modelled;
 * everything else (relation, update, delete, truncate, origin, type) arrives as {@link Skipped}.
 */
public sealed interface WalChange permits WalChange.Begin, WalChange.Commit, WalChange.Insert, WalChange.Skipped {

    WalPosition position();

    record Begin(WalPosition position, WalPosition finalPosition, Instant committedAt, long xid) implements WalChange {}

    record Commit(WalPosition position, WalPosition commitPosition, WalPosition endPosition, Instant committedAt)
        implements WalChange {}

    /**
     * A new row. Column values are the server's text representation; SQL NULL maps to {@code null}.
     */
    record Insert(WalPosition position, String schema, String table, Map<String, String> columns) implements WalChange {

        public Insert {
            // Map.copyOf rejects null values
            columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        }
    }

    record Skipped(WalPosition position, char messageType) implements WalChange {}
}
