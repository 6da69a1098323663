package com.pgoutbox.adapter.in.replication;

import com.pgoutbox.application.port.out.WalStream;
import com.pgoutbox.domain.model.WalChange;
import com.pgoutbox.domain.model.WalPosition;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;

import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * {@link WalStream} over a pgjdbc replication stream. Owns the replication connection and closes it.
 */
public class PgWalStream implements WalStream {

    private final Connection connection;
    private final PGReplicationStream stream;
    private final PgOutputDecoder decoder;
    private final WalPosition startPosition;

    PgWalStream(Connection connection, PGReplicationStream stream, PgOutputDecoder decoder, WalPosition startPosition) {
        this.connection = connection;
        this.stream = stream;
        this.decoder = decoder;
        this.startPosition = startPosition;
    }

    @Override
    public Optional<WalChange> poll() throws SQLException {
        ByteBuffer buffer = stream.readPending();
        if (buffer == null) {
            return Optional.empty();
        }
        WalPosition position = WalPosition.of(stream.getLastReceiveLSN().asLong());
        return Optional.of(decoder.decode(buffer, position));
    }

    @Override
    public void confirm(WalPosition position) throws SQLException {
        LogSequenceNumber lsn = LogSequenceNumber.valueOf(position.value());
        stream.setAppliedLSN(lsn);
        stream.setFlushedLSN(lsn);
        stream.forceUpdateStatus();
    }

    @Override
    public WalPosition startPosition() {
        return startPosition;
    }

    @Override
    public void close() throws SQLException {
        SQLException failure = null;
        try {
            if (!stream.isClosed()) {
                stream.close();
            }
        } catch (SQLException e) {
            failure = e;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
