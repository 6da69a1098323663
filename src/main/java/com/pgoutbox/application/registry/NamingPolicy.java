package com.pgoutbox.application.registry;

import com.pgoutbox.infrastructure.exception.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the discriminator stored in the outbox for a message kind.
 * Policies are explicit functions fixed at configuration time.
 */
@FunctionalInterface
public interface NamingPolicy {

    String discriminatorFor(Class<?> kind);

    /**
     * A fixed lookup table. Kinds missing from the table are a configuration error.
     */
    static NamingPolicy explicit(Map<Class<?>, String> table) {
        Map<Class<?>, String> copy = new LinkedHashMap<>(table);
        return kind -> {
            String discriminator = copy.get(kind);
            if (discriminator == null) {
                throw new ConfigurationException("No discriminator configured for " + kind.getName());
            }
            return discriminator;
        };
    }

    static NamingPolicy simpleName() {
        return Class::getSimpleName;
    }
}
