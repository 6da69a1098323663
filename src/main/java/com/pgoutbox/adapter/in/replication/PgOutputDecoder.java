package com.pgoutbox.adapter.in.replication;

import com.pgoutbox.domain.model.WalChange;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.exception.PgOutputProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoder for the binary {@code pgoutput} logical replication protocol, version 1.
 * Keeps the relation metadata announced by the server so that tuples can be mapped to column names.
 * One instance per replication session; not thread-safe.
 */
public class PgOutputDecoder {

    private static final Logger log = LoggerFactory.getLogger(PgOutputDecoder.class);

    // 2000-01-01T00:00:00Z in microseconds since the Unix epoch
    static final long PG_EPOCH_OFFSET_MICROS = 946_684_800_000_000L;

    private final Map<Integer, Relation> relations = new HashMap<>();

    public WalChange decode(ByteBuffer buffer, WalPosition position) {
        if (!buffer.hasRemaining()) {
            throw new PgOutputProtocolException("Empty replication message at " + position);
        }
        char type = (char) buffer.get();
        try {
            return switch (type) {
                case 'B' -> decodeBegin(buffer, position);
                case 'C' -> decodeCommit(buffer, position);
                case 'R' -> decodeRelation(buffer, position);
                case 'I' -> decodeInsert(buffer, position);
                default -> {
                    log.trace("Skipping pgoutput message '{}' at {}", type, position);
                    yield new WalChange.Skipped(position, type);
                }
            };
        } catch (BufferUnderflowException | IndexOutOfBoundsException | NegativeArraySizeException e) {
            throw new PgOutputProtocolException("Truncated pgoutput message '" + type + "' at " + position, e);
        }
    }

    public boolean knowsRelation(int relationId) {
        return relations.containsKey(relationId);
    }

    private WalChange decodeBegin(ByteBuffer buffer, WalPosition position) {
        WalPosition finalPosition = WalPosition.of(buffer.getLong());
        Instant committedAt = toInstant(buffer.getLong());
        long xid = Integer.toUnsignedLong(buffer.getInt());
        return new WalChange.Begin(position, finalPosition, committedAt, xid);
    }

    private WalChange decodeCommit(ByteBuffer buffer, WalPosition position) {
        buffer.get(); // flags, unused
        WalPosition commitPosition = WalPosition.of(buffer.getLong());
        WalPosition endPosition = WalPosition.of(buffer.getLong());
        Instant committedAt = toInstant(buffer.getLong());
        return new WalChange.Commit(position, commitPosition, endPosition, committedAt);
    }

    private WalChange decodeRelation(ByteBuffer buffer, WalPosition position) {
        int relationId = buffer.getInt();
        String namespace = readCString(buffer);
        String name = readCString(buffer);
        buffer.get(); // replica identity
        int columnCount = Short.toUnsignedInt(buffer.getShort());

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            buffer.get(); // flags
            columns.add(readCString(buffer));
            buffer.getInt(); // type oid
            buffer.getInt(); // type modifier
        }

        // the server sends an empty namespace for pg_catalog
        String schema = namespace.isEmpty() ? "pg_catalog" : namespace;
        relations.put(relationId, new Relation(schema, name, columns));
        log.debug("Relation {} is {}.{} with columns {}", relationId, schema, name, columns);
        return new WalChange.Skipped(position, 'R');
    }

    private WalChange decodeInsert(ByteBuffer buffer, WalPosition position) {
        int relationId = buffer.getInt();
        Relation relation = relations.get(relationId);
        if (relation == null) {
            throw new PgOutputProtocolException("Insert at " + position + " references unknown relation " + relationId);
        }
        char marker = (char) buffer.get();
        if (marker != 'N') {
            throw new PgOutputProtocolException("Expected new tuple marker 'N' at " + position + ", got '" + marker + "'");
        }
        return new WalChange.Insert(position, relation.schema(), relation.name(), readTuple(buffer, relation, position));
    }

    private Map<String, String> readTuple(ByteBuffer buffer, Relation relation, WalPosition position) {
        int columnCount = Short.toUnsignedInt(buffer.getShort());
        if (columnCount != relation.columns().size()) {
            throw new PgOutputProtocolException("Tuple at " + position + " has " + columnCount
                + " columns, relation " + relation.name() + " declares " + relation.columns().size());
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < columnCount; i++) {
            String column = relation.columns().get(i);
            char kind = (char) buffer.get();
            switch (kind) {
                case 'n', 'u' -> values.put(column, null);
                case 't', 'b' -> {
                    byte[] bytes = new byte[buffer.getInt()];
                    buffer.get(bytes);
                    values.put(column, new String(bytes, StandardCharsets.UTF_8));
                }
                default -> throw new PgOutputProtocolException(
                    "Unknown tuple column kind '" + kind + "' at " + position);
            }
        }
        return values;
    }

    private static String readCString(ByteBuffer buffer) {
        int start = buffer.position();
        int end = start;
        while (buffer.get(end) != 0) {
            end++;
        }
        byte[] bytes = new byte[end - start];
        buffer.get(bytes);
        buffer.get(); // terminator
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static Instant toInstant(long pgMicros) {
        long micros = pgMicros + PG_EPOCH_OFFSET_MICROS;
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    private record Relation(String schema, String name, List<String> columns) {}
}
