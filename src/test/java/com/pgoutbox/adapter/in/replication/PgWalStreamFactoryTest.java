package com.pgoutbox.adapter.in.replication;

import com.pgoutbox.application.config.ConnectionSettings;
import com.pgoutbox.application.port.out.WalStream;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.exception.SlotInUseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationConnection;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.ReplicationSlotInfo;
import org.postgresql.replication.ReplicationType;
import org.postgresql.replication.fluent.ChainedCreateReplicationSlotBuilder;
import org.postgresql.replication.fluent.ChainedStreamBuilder;
import org.postgresql.replication.fluent.logical.ChainedLogicalCreateSlotBuilder;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PgWalStreamFactoryTest {

    private static final ConnectionSettings SETTINGS =
        new ConnectionSettings("jdbc:postgresql://localhost/outbox", "outbox", "secret");

    @Test
    void replicationPropertiesSelectDatabaseReplicationMode() {
        PgWalStreamFactory factory = new PgWalStreamFactory(SETTINGS, Duration.ofSeconds(10));

        Properties props = factory.replicationProperties();

        assertEquals("database", PGProperty.REPLICATION.get(props));
        assertEquals("simple", PGProperty.PREFER_QUERY_MODE.get(props));
        assertEquals("10", PGProperty.ASSUME_MIN_SERVER_VERSION.get(props));
        assertEquals("outbox", PGProperty.USER.get(props));
        assertEquals("secret", PGProperty.PASSWORD.get(props));
    }

    @Test
    void blankPasswordIsNotSent() {
        PgWalStreamFactory factory = new PgWalStreamFactory(
            new ConnectionSettings("jdbc:postgresql://localhost/outbox", "outbox", ""), Duration.ofSeconds(10));

        assertNull(factory.replicationProperties().getProperty(PGProperty.PASSWORD.getName()));
    }

    @Nested
    @DisplayName("Opening a stream")
    @ExtendWith(MockitoExtension.class)
    class Open {

        private static final PublicationSpec PUBLICATION =
            new PublicationSpec("outbox_pub", TableDescriptor.defaults(), Set.of("a"), false);

        @Mock
        private Connection connection;

        @Mock
        private PGConnection pgConnection;

        @Mock
        private PGReplicationConnection replicationApi;

        @Mock
        private ChainedStreamBuilder streamBuilder;

        @Mock
        private ChainedCreateReplicationSlotBuilder slotBuilder;

        @Mock
        private PGReplicationStream replicationStream;

        private ChainedLogicalStreamBuilder logicalStream;
        private ChainedLogicalCreateSlotBuilder logicalSlot;
        private PgWalStreamFactory factory;

        @BeforeEach
        void setUp() throws SQLException {
            // fluent builders hand themselves back from every with* call
            logicalStream = mock(ChainedLogicalStreamBuilder.class, RETURNS_SELF);
            logicalSlot = mock(ChainedLogicalCreateSlotBuilder.class, RETURNS_SELF);

            when(connection.unwrap(PGConnection.class)).thenReturn(pgConnection);
            when(pgConnection.getReplicationAPI()).thenReturn(replicationApi);

            factory = new PgWalStreamFactory(SETTINGS, Duration.ofSeconds(10)) {
                @Override
                Connection connect() {
                    return connection;
                }
            };
        }

        private void streamStartsWith(SQLException failure) throws SQLException {
            when(replicationApi.replicationStream()).thenReturn(streamBuilder);
            when(streamBuilder.logical()).thenReturn(logicalStream);
            if (failure != null) {
                when(logicalStream.start()).thenThrow(failure);
            } else {
                when(logicalStream.start()).thenReturn(replicationStream);
            }
        }

        private void temporarySlotCreation() {
            when(replicationApi.createReplicationSlot()).thenReturn(slotBuilder);
            when(slotBuilder.logical()).thenReturn(logicalSlot);
        }

        @Test
        @DisplayName("Durable slot held by another connection is reported as in use")
        void durableSlotInUse() throws SQLException {
            // Given
            streamStartsWith(new SQLException("replication slot \"outbox_slot\" is active for PID 42", "55006"));

            // When
            SlotInUseException e = assertThrows(SlotInUseException.class, () ->
                factory.open(ReplicationSlotSpec.durable("outbox_slot"), PUBLICATION, WalPosition.of(100)));

            // Then
            assertEquals("outbox_slot", e.getSlotName());
            assertEquals("55006", ((SQLException) e.getCause()).getSQLState());
            verify(connection).close();
        }

        @Test
        @DisplayName("Temporary slot name taken by another session is reported as in use")
        void temporarySlotInUse() throws SQLException {
            // Given
            temporarySlotCreation();
            when(logicalSlot.make()).thenThrow(new SQLException("replication slot \"tmp\" already exists", "42710"));

            // When
            SlotInUseException e = assertThrows(SlotInUseException.class, () ->
                factory.open(ReplicationSlotSpec.temporary("tmp"), PUBLICATION, WalPosition.INVALID));

            // Then
            assertEquals("tmp", e.getSlotName());
            verify(logicalSlot).withTemporaryOption();
            verify(replicationApi, never()).replicationStream();
            verify(connection).close();
        }

        @Test
        @DisplayName("Other failures are passed through as connection errors")
        void otherFailuresPassThrough() throws SQLException {
            streamStartsWith(new SQLException("connection reset", "08006"));

            SQLException e = assertThrows(SQLException.class, () ->
                factory.open(ReplicationSlotSpec.durable("outbox_slot"), PUBLICATION, WalPosition.of(100)));

            assertEquals("08006", e.getSQLState());
            verify(connection).close();
        }

        @Test
        @DisplayName("Temporary slot streams from its consistent point")
        void temporarySlotStartsAtConsistentPoint() throws SQLException {
            // Given
            temporarySlotCreation();
            when(logicalSlot.make()).thenReturn(new ReplicationSlotInfo(
                "tmp", ReplicationType.LOGICAL, LogSequenceNumber.valueOf(0x16B3748L), null, "pgoutput"));
            streamStartsWith(null);

            // When
            WalStream stream = factory.open(ReplicationSlotSpec.temporary("tmp"), PUBLICATION, WalPosition.INVALID);

            // Then
            assertEquals(WalPosition.of(0x16B3748L), stream.startPosition());
            verify(logicalStream).withStartPosition(LogSequenceNumber.valueOf(0x16B3748L));
            verify(logicalStream).withSlotOption("publication_names", PUBLICATION.quotedName());
            verify(connection, never()).close();
        }
    }
}
