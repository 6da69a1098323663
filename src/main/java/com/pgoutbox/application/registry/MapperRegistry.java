package com.pgoutbox.application.registry;

import com.pgoutbox.infrastructure.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Discriminator to (mapper, handler) table. Filled while options are built, read-only afterwards.
 */
public class MapperRegistry {

    public static final String WILDCARD = "*";

    private final Map<String, RegistryEntry<?>> entries;
    private final boolean frozen;

    public MapperRegistry() {
        this(new LinkedHashMap<>(), false);
    }

    private MapperRegistry(Map<String, RegistryEntry<?>> entries, boolean frozen) {
        this.entries = entries;
        this.frozen = frozen;
    }

    public <T> void register(String discriminator, PayloadMapper<T> mapper, MessageHandler<T> handler) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen");
        }
        if (discriminator == null || discriminator.isBlank()) {
            throw new ConfigurationException("Discriminator must not be blank");
        }
        if (entries.containsKey(discriminator)) {
            String what = WILDCARD.equals(discriminator) ? "A wildcard consumer" : "A consumer for '" + discriminator + "'";
            throw new ConfigurationException(what + " is already registered");
        }
        entries.put(discriminator, new RegistryEntry<>(mapper, handler));
    }

    /**
     * Exact match first, then the wildcard entry if one is registered.
     */
    public Optional<RegistryEntry<?>> lookup(String discriminator) {
        Objects.requireNonNull(discriminator, "discriminator");
        RegistryEntry<?> entry = entries.get(discriminator);
        if (entry == null) {
            entry = entries.get(WILDCARD);
        }
        return Optional.ofNullable(entry);
    }

    /**
     * Registered discriminators, wildcard excluded.
     */
    public Set<String> discriminators() {
        Set<String> keys = new LinkedHashSet<>(entries.keySet());
        keys.remove(WILDCARD);
        return Collections.unmodifiableSet(keys);
    }

    public boolean hasWildcard() {
        return entries.containsKey(WILDCARD);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Immutable copy handed to the running engine.
     */
    public MapperRegistry freeze() {
        return new MapperRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(entries)), true);
    }
}
