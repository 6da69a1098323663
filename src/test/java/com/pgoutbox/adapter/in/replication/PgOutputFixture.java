package com.pgoutbox.adapter.in.replication;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builds pgoutput v1 messages byte by byte.
 */
final class PgOutputFixture {

    private final ByteBuffer buffer = ByteBuffer.allocate(4096);

    private PgOutputFixture(char type) {
        buffer.put((byte) type);
    }

    static ByteBuffer begin(long finalLsn, long pgMicros, int xid) {
        return new PgOutputFixture('B').int64(finalLsn).int64(pgMicros).int32(xid).build();
    }

    static ByteBuffer commit(long commitLsn, long endLsn, long pgMicros) {
        return new PgOutputFixture('C').int8(0).int64(commitLsn).int64(endLsn).int64(pgMicros).build();
    }

    static ByteBuffer relation(int relationId, String namespace, String name, String... columns) {
        PgOutputFixture fixture = new PgOutputFixture('R')
            .int32(relationId).cstring(namespace).cstring(name).int8('d').int16(columns.length);
        for (String column : columns) {
            fixture.int8(0).cstring(column).int32(25).int32(-1);
        }
        return fixture.build();
    }

    /**
     * Insert with text values; a null value is sent as a SQL NULL column.
     */
    static ByteBuffer insert(int relationId, String... values) {
        PgOutputFixture fixture = new PgOutputFixture('I').int32(relationId).int8('N').int16(values.length);
        for (String value : values) {
            if (value == null) {
                fixture.int8('n');
            } else {
                byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
                fixture.int8('t').int32(bytes.length).bytes(bytes);
            }
        }
        return fixture.build();
    }

    static PgOutputFixture message(char type) {
        return new PgOutputFixture(type);
    }

    PgOutputFixture int8(int value) {
        buffer.put((byte) value);
        return this;
    }

    PgOutputFixture int16(int value) {
        buffer.putShort((short) value);
        return this;
    }

    PgOutputFixture int32(int value) {
        buffer.putInt(value);
        return this;
    }

    PgOutputFixture int64(long value) {
        buffer.putLong(value);
        return this;
    }

    PgOutputFixture cstring(String value) {
        buffer.put(value.getBytes(StandardCharsets.UTF_8));
        buffer.put((byte) 0);
        return this;
    }

    PgOutputFixture bytes(byte[] value) {
        buffer.put(value);
        return this;
    }

    ByteBuffer build() {
        ByteBuffer copy = ByteBuffer.allocate(buffer.position());
        copy.put(buffer.array(), 0, buffer.position());
        copy.flip();
        return copy;
    }
}
