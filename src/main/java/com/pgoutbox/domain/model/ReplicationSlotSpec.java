package com.pgoutbox.domain.model;

/**
 * A logical replication slot. Temporary slots live only as long as the streaming
 * connection that created them; durable slots survive consumer restarts.
 */
public record ReplicationSlotSpec(String slotName, String plugin, boolean temporary) {

    public static final String DEFAULT_SLOT_NAME = "outbox_slot";
    public static final String PGOUTPUT = "pgoutput";

    public ReplicationSlotSpec {
        if (slotName == null || !slotName.matches("[a-z0-9_]{1,63}")) {
            throw new IllegalArgumentException(
                "Slot name may only contain lower case letters, numbers and underscores: " + slotName);
        }
        if (plugin == null || plugin.isBlank()) {
            throw new IllegalArgumentException("Decoding plugin cannot be empty");
        }
    }

    public static ReplicationSlotSpec defaults() {
        return durable(DEFAULT_SLOT_NAME);
    }

    public static ReplicationSlotSpec durable(String slotName) {
        return new ReplicationSlotSpec(slotName, PGOUTPUT, false);
    }

    public static ReplicationSlotSpec temporary(String slotName) {
        return new ReplicationSlotSpec(slotName, PGOUTPUT, true);
    }
}
