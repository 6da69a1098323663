package com.pgoutbox.application.port.out;

import java.util.UUID;

/**
 * Producer side of the outbox. Writes join the caller's transaction.
 */
public interface OutboxAppender {

    /**
     * Serializes a whitelisted message kind and inserts it.
     *
     * @return the id of the new row
     * @throws com.pgoutbox.infrastructure.exception.ConfigurationException if the kind has no discriminator
     */
    UUID append(Object message);

    UUID appendRaw(String discriminator, String jsonPayload);

    long count();

    void deleteAll();
}
