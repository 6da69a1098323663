package com.pgoutbox.adapter.in.replication;

import com.pgoutbox.application.config.ConnectionSettings;
import com.pgoutbox.application.port.out.WalStream;
import com.pgoutbox.application.port.out.WalStreamFactory;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.exception.SlotInUseException;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.ReplicationSlotInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Opens dedicated, non-pooled pgjdbc connections in {@code replication=database} mode and starts
 * {@code pgoutput} streaming on them.
 */
public class PgWalStreamFactory implements WalStreamFactory {

    private static final Logger log = LoggerFactory.getLogger(PgWalStreamFactory.class);

    static final String OBJECT_IN_USE = "55006";
    static final String DUPLICATE_OBJECT = "42710";

    private final ConnectionSettings connection;
    private final Duration statusInterval;

    public PgWalStreamFactory(ConnectionSettings connection, Duration statusInterval) {
        this.connection = connection;
        this.statusInterval = statusInterval;
    }

    @Override
    public WalStream open(ReplicationSlotSpec slot, PublicationSpec publication, WalPosition start) throws SQLException {
        Connection replicationConnection = connect();
        try {
            PGConnection pgConnection = replicationConnection.unwrap(PGConnection.class);

            WalPosition startPosition = start;
            if (slot.temporary()) {
                ReplicationSlotInfo info = pgConnection.getReplicationAPI()
                    .createReplicationSlot()
                    .logical()
                    .withSlotName(slot.slotName())
                    .withOutputPlugin(slot.plugin())
                    .withTemporaryOption()
                    .make();
                startPosition = WalPosition.of(info.getConsistentPoint().asLong());
                log.info("Created temporary replication slot {} at {}", slot.slotName(), startPosition);
            }

            PGReplicationStream stream = pgConnection.getReplicationAPI()
                .replicationStream()
                .logical()
                .withSlotName(slot.slotName())
                .withStartPosition(LogSequenceNumber.valueOf(startPosition.value()))
                .withSlotOption("proto_version", 1)
                .withSlotOption("publication_names", publication.quotedName())
                .withStatusInterval((int) statusInterval.toMillis(), TimeUnit.MILLISECONDS)
                .start();

            log.debug("Replication stream on slot {} started at {}", slot.slotName(), startPosition);
            return new PgWalStream(replicationConnection, stream, new PgOutputDecoder(), startPosition);
        } catch (SQLException e) {
            closeAfterFailure(replicationConnection, e);
            if (OBJECT_IN_USE.equals(e.getSQLState())) {
                throw new SlotInUseException(slot.slotName(), e);
            }
            // another session holds a temporary slot with this name
            if (slot.temporary() && DUPLICATE_OBJECT.equals(e.getSQLState())) {
                throw new SlotInUseException(slot.slotName(), e);
            }
            throw e;
        } catch (RuntimeException e) {
            closeAfterFailure(replicationConnection, e);
            throw e;
        }
    }

    Connection connect() throws SQLException {
        return DriverManager.getConnection(connection.url(), replicationProperties());
    }

    Properties replicationProperties() {
        Properties props = new Properties();
        if (connection.username() != null) {
            PGProperty.USER.set(props, connection.username());
        }
        if (connection.password() != null && !connection.password().isBlank()) {
            PGProperty.PASSWORD.set(props, connection.password());
        }
        PGProperty.REPLICATION.set(props, "database");
        PGProperty.PREFER_QUERY_MODE.set(props, "simple");
        PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
        return props;
    }

    private static void closeAfterFailure(Connection replicationConnection, Exception primary) {
        try {
            replicationConnection.close();
        } catch (SQLException closeFailure) {
            primary.addSuppressed(closeFailure);
        }
    }
}
