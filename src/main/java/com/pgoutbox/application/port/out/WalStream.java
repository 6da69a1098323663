package com.pgoutbox.application.port.out;

import com.pgoutbox.domain.model.WalChange;
import com.pgoutbox.domain.model.WalPosition;

import java.sql.SQLException;
import java.util.Optional;

/**
 * An open logical replication session, already decoded into {@link WalChange}s.
 */
public interface WalStream extends AutoCloseable {

    /**
     * Next change if one is available, without blocking.
     */
    Optional<WalChange> poll() throws SQLException;

    /**
     * Reports everything up to {@code position} as processed. The server may then recycle that WAL.
     */
    void confirm(WalPosition position) throws SQLException;

    /**
     * Position the stream started from. For temporary slots this is the slot's consistent point.
     */
    WalPosition startPosition();

    @Override
    void close() throws SQLException;
}
