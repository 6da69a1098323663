package com.pgoutbox.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One outbox row as decoded from the replication stream.
 *
 * @param messageId     the row's primary key, as text
 * @param discriminator the routing tag of the row
 * @param payload       the JSON text of the payload column
 * @param position      WAL position of the insert
 * @param committedAt   commit timestamp of the producing transaction
 */
public record MessageEnvelope(
    String messageId,
    String discriminator,
    String payload,
    WalPosition position,
    Instant committedAt
) {

    public MessageEnvelope {
        Objects.requireNonNull(discriminator, "discriminator");
        Objects.requireNonNull(position, "position");
    }
}
