package com.pgoutbox.application.port.out;

import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.WalPosition;

import java.util.Optional;

public interface ReplicationSlotManager {

    /**
     * Creates a durable slot if absent, otherwise validates it.
     *
     * @throws com.pgoutbox.infrastructure.exception.SchemaConflictException if the slot uses another plugin
     * @throws com.pgoutbox.infrastructure.exception.SlotInUseException if another connection streams from it
     */
    SlotStatus ensureSlot(ReplicationSlotSpec slot);

    /**
     * The slot's {@code confirmed_flush_lsn}, empty when the slot does not exist.
     */
    Optional<WalPosition> readConfirmedPosition(String slotName);

    void dropSlot(String slotName);

    record SlotStatus(boolean created, WalPosition confirmedPosition) {}
}
