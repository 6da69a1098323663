package com.pgoutbox.application.port.out;

import java.util.UUID;

/**
 * Port for generating outbox row identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new unique identifier. Implementations should be time-ordered (UUIDv7).
     */
    UUID generate();

    /**
     * Milliseconds since epoch encoded in a time-based UUID.
     */
    long extractTimestamp(UUID id);
}
