package com.pgoutbox.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.pgoutbox.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered outbox row ids, so the primary key index grows at its right edge.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator;

    public UUIDv7Generator() {
        this.generator = Generators.timeBasedEpochGenerator();
    }

    @Override
    public UUID generate() {
        return generator.generate();
    }

    @Override
    public long extractTimestamp(UUID uuid) {
        if (uuid.version() != 7) {
            throw new IllegalArgumentException("Not a version 7 UUID: " + uuid);
        }
        return uuid.getMostSignificantBits() >>> 16;
    }
}
