package com.pgoutbox.infrastructure.exception;

public class SlotInUseException extends OutboxException {

    private final String slotName;

    public SlotInUseException(String slotName) {
        super("SLOT_IN_USE", "Replication slot " + slotName + " is already consumed by another connection");
        this.slotName = slotName;
    }

    public SlotInUseException(String slotName, Throwable cause) {
        super("SLOT_IN_USE", "Replication slot " + slotName + " is already consumed by another connection", cause);
        this.slotName = slotName;
    }

    public String getSlotName() {
        return slotName;
    }
}
