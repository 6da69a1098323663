package com.pgoutbox.application.registry;

import com.pgoutbox.infrastructure.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapperRegistry")
class MapperRegistryTest {

    private final List<String> received = new ArrayList<>();

    @Test
    @DisplayName("Exact match wins over the wildcard")
    void exactMatchWins() throws Exception {
        MapperRegistry registry = new MapperRegistry();
        registry.register("a", PayloadMapper.RawString.INSTANCE, p -> received.add("exact:" + p));
        registry.register(MapperRegistry.WILDCARD, PayloadMapper.RawString.INSTANCE, p -> received.add("any:" + p));

        deliver(registry.lookup("a").orElseThrow(), "1");
        deliver(registry.lookup("b").orElseThrow(), "2");

        assertEquals(List.of("exact:1", "any:2"), received);
    }

    @Test
    @DisplayName("Lookup is empty without a match or wildcard")
    void lookupEmptyWithoutMatch() {
        MapperRegistry registry = new MapperRegistry();
        registry.register("a", PayloadMapper.RawString.INSTANCE, received::add);

        assertTrue(registry.lookup("b").isEmpty());
        assertFalse(registry.hasWildcard());
    }

    @Test
    @DisplayName("Rejects duplicate and blank discriminators")
    void rejectsDuplicates() {
        MapperRegistry registry = new MapperRegistry();
        registry.register("a", PayloadMapper.RawString.INSTANCE, received::add);
        registry.register(MapperRegistry.WILDCARD, PayloadMapper.RawString.INSTANCE, received::add);

        ConfigurationException duplicate = assertThrows(ConfigurationException.class,
            () -> registry.register("a", PayloadMapper.RawString.INSTANCE, received::add));
        ConfigurationException wildcard = assertThrows(ConfigurationException.class,
            () -> registry.register(MapperRegistry.WILDCARD, PayloadMapper.RawString.INSTANCE, received::add));

        assertEquals("A consumer for 'a' is already registered", duplicate.getMessage());
        assertEquals("A wildcard consumer is already registered", wildcard.getMessage());
        assertThrows(ConfigurationException.class,
            () -> registry.register("", PayloadMapper.RawString.INSTANCE, received::add));
    }

    @Test
    @DisplayName("Frozen copy is read-only and excludes the wildcard from discriminators")
    void freezeProducesReadOnlyCopy() {
        MapperRegistry registry = new MapperRegistry();
        registry.register("a", PayloadMapper.RawString.INSTANCE, received::add);
        registry.register(MapperRegistry.WILDCARD, PayloadMapper.RawString.INSTANCE, received::add);

        MapperRegistry frozen = registry.freeze();

        assertTrue(frozen.isFrozen());
        assertFalse(registry.isFrozen());
        assertEquals(Set.of("a"), frozen.discriminators());
        assertTrue(frozen.hasWildcard());
        assertThrows(IllegalStateException.class,
            () -> frozen.register("b", PayloadMapper.RawString.INSTANCE, received::add));
    }

    private static <T> void deliver(RegistryEntry<T> entry, String payload) throws Exception {
        entry.handler().handle(entry.mapper().map(payload));
    }
}
