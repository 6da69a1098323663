package com.pgoutbox.application.registry;

import java.util.Objects;

public record RegistryEntry<T>(PayloadMapper<T> mapper, MessageHandler<T> handler) {

    public RegistryEntry {
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(handler, "handler");
    }
}
