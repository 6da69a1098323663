package com.pgoutbox.application.port.out;

import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.WalPosition;

import java.sql.SQLException;

@FunctionalInterface
public interface WalStreamFactory {

    /**
     * Opens a replication connection and starts streaming from {@code start}.
     * Temporary slots are created on that connection first.
     *
     * @throws com.pgoutbox.infrastructure.exception.SlotInUseException if the slot is active elsewhere
     */
    WalStream open(ReplicationSlotSpec slot, PublicationSpec publication, WalPosition start) throws SQLException;
}
