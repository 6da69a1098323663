package com.pgoutbox.application.registry;

import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.Result;
import com.pgoutbox.infrastructure.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional, one-to-one mapping between whitelisted message kinds and their discriminators.
 * Only whitelisted kinds are ever resolved; nothing is looked up by class name at runtime.
 */
public class TypeResolver {

    private final NamingPolicy namingPolicy;
    private final Map<String, Class<?>> byDiscriminator = new LinkedHashMap<>();
    private final Map<Class<?>, String> byKind = new LinkedHashMap<>();

    public TypeResolver(NamingPolicy namingPolicy) {
        this.namingPolicy = Objects.requireNonNull(namingPolicy, "namingPolicy");
    }

    /**
     * Registers a kind and returns its discriminator. Re-registering the same kind is a no-op.
     *
     * @throws ConfigurationException if the derived discriminator is blank or already taken by another kind
     */
    public synchronized String whitelist(Class<?> kind) {
        Objects.requireNonNull(kind, "kind");
        String existing = byKind.get(kind);
        if (existing != null) {
            return existing;
        }

        String discriminator = namingPolicy.discriminatorFor(kind);
        if (discriminator == null || discriminator.isBlank()) {
            throw new ConfigurationException("Naming policy produced a blank discriminator for " + kind.getName());
        }
        Class<?> taken = byDiscriminator.get(discriminator);
        if (taken != null) {
            throw new ConfigurationException("Discriminator '" + discriminator + "' is already bound to "
                + taken.getName() + ", cannot bind it to " + kind.getName());
        }

        byDiscriminator.put(discriminator, kind);
        byKind.put(kind, discriminator);
        return discriminator;
    }

    public synchronized Result<Class<?>, DispatchError.UnknownDiscriminator> resolve(String discriminator) {
        Class<?> kind = byDiscriminator.get(discriminator);
        if (kind == null) {
            return Result.failure(new DispatchError.UnknownDiscriminator(discriminator));
        }
        return Result.success(kind);
    }

    public synchronized Optional<String> discriminatorOf(Class<?> kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public synchronized Set<String> discriminators() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byDiscriminator.keySet()));
    }
}
