package com.pgoutbox.application.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgoutbox.application.error.ErrorProcessor;
import com.pgoutbox.application.error.LoggingErrorProcessor;
import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.registry.MapperRegistry;
import com.pgoutbox.application.registry.MessageHandler;
import com.pgoutbox.application.registry.NamingPolicy;
import com.pgoutbox.application.registry.PayloadMapper;
import com.pgoutbox.application.registry.TypeResolver;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.ConfigurationException;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collects subscription configuration. Single-valued options may be set once; {@link #build()}
 * validates the combination and returns an immutable {@link SubscriptionOptions}.
 */
public final class SubscriptionOptionsBuilder {

    private ConnectionSettings connection;
    private DataSource dataSource;
    private TableDescriptor table;
    private NamingPolicy namingPolicy;
    private ObjectMapper jsonMapper;
    private String publicationName;
    private boolean filterByDiscriminator;
    private ReplicationSlotSpec slot;
    private ErrorProcessor errorProcessor;
    private ReconnectPolicy reconnectPolicy;
    private ConfirmationPolicy confirmationPolicy;
    private MetricsPort metrics;

    private final Map<Class<?>, MessageHandler<?>> typedConsumers = new LinkedHashMap<>();
    private final Map<String, MessageHandler<String>> rawStringConsumers = new LinkedHashMap<>();
    private final Map<String, MessageHandler<JsonNode>> rawObjectConsumers = new LinkedHashMap<>();
    private boolean built;

    SubscriptionOptionsBuilder() {
    }

    public SubscriptionOptionsBuilder connection(ConnectionSettings connection) {
        ensureUnset(this.connection, "connection");
        this.connection = Objects.requireNonNull(connection, "connection");
        return this;
    }

    public SubscriptionOptionsBuilder dataSource(DataSource dataSource) {
        ensureUnset(this.dataSource, "dataSource");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        return this;
    }

    public SubscriptionOptionsBuilder table(TableDescriptor table) {
        ensureUnset(this.table, "table");
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    public SubscriptionOptionsBuilder namingPolicy(NamingPolicy namingPolicy) {
        ensureUnset(this.namingPolicy, "namingPolicy");
        this.namingPolicy = Objects.requireNonNull(namingPolicy, "namingPolicy");
        return this;
    }

    public SubscriptionOptionsBuilder jsonMapper(ObjectMapper jsonMapper) {
        ensureUnset(this.jsonMapper, "jsonMapper");
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
        return this;
    }

    public SubscriptionOptionsBuilder publication(String name, boolean filterByDiscriminator) {
        ensureUnset(this.publicationName, "publication");
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Publication name cannot be empty");
        }
        this.publicationName = name;
        this.filterByDiscriminator = filterByDiscriminator;
        return this;
    }

    public SubscriptionOptionsBuilder replicationSlot(ReplicationSlotSpec slot) {
        ensureUnset(this.slot, "replicationSlot");
        this.slot = Objects.requireNonNull(slot, "slot");
        return this;
    }

    public SubscriptionOptionsBuilder errorProcessor(ErrorProcessor errorProcessor) {
        ensureUnset(this.errorProcessor, "errorProcessor");
        this.errorProcessor = Objects.requireNonNull(errorProcessor, "errorProcessor");
        return this;
    }

    public SubscriptionOptionsBuilder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
        ensureUnset(this.reconnectPolicy, "reconnectPolicy");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        return this;
    }

    public SubscriptionOptionsBuilder confirmationPolicy(ConfirmationPolicy confirmationPolicy) {
        ensureUnset(this.confirmationPolicy, "confirmationPolicy");
        this.confirmationPolicy = Objects.requireNonNull(confirmationPolicy, "confirmationPolicy");
        return this;
    }

    public SubscriptionOptionsBuilder metrics(MetricsPort metrics) {
        ensureUnset(this.metrics, "metrics");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        return this;
    }

    /**
     * Consumes a whitelisted message kind; its discriminator comes from the naming policy at build time.
     */
    public <T> SubscriptionOptionsBuilder consumes(Class<T> kind, MessageHandler<T> handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        if (typedConsumers.putIfAbsent(kind, handler) != null) {
            throw new ConfigurationException("A consumer for " + kind.getName() + " is already registered");
        }
        return this;
    }

    public SubscriptionOptionsBuilder consumesRawString(String discriminator, MessageHandler<String> handler) {
        claim(discriminator);
        rawStringConsumers.put(discriminator, Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public SubscriptionOptionsBuilder consumesRawObject(String discriminator, MessageHandler<JsonNode> handler) {
        claim(discriminator);
        rawObjectConsumers.put(discriminator, Objects.requireNonNull(handler, "handler"));
        return this;
    }

    /**
     * Receives every row whose discriminator has no dedicated consumer, as text.
     */
    public SubscriptionOptionsBuilder consumesRawStrings(MessageHandler<String> handler) {
        return consumesRawString(MapperRegistry.WILDCARD, handler);
    }

    public SubscriptionOptionsBuilder consumesRawObjects(MessageHandler<JsonNode> handler) {
        return consumesRawObject(MapperRegistry.WILDCARD, handler);
    }

    public SubscriptionOptions build() {
        if (built) {
            throw new ConfigurationException("build() called more than once on SubscriptionOptionsBuilder");
        }
        ensureSet(connection, "connection");
        ensureSet(dataSource, "dataSource");

        MapperRegistry registry = new MapperRegistry();
        rawStringConsumers.forEach((discriminator, handler) ->
            registry.register(discriminator, PayloadMapper.RawString.INSTANCE, handler));
        if (!rawObjectConsumers.isEmpty()) {
            PayloadMapper.RawObject mapper = new PayloadMapper.RawObject(jsonMapper != null ? jsonMapper : new ObjectMapper());
            rawObjectConsumers.forEach((discriminator, handler) -> registry.register(discriminator, mapper, handler));
        }

        TypeResolver typeResolver = new TypeResolver(namingPolicy != null ? namingPolicy : NamingPolicy.simpleName());
        if (!typedConsumers.isEmpty()) {
            ensureSet(namingPolicy, "namingPolicy");
            if (jsonMapper == null) {
                throw new ConfigurationException("`consumes` requires a `jsonMapper` on SubscriptionOptionsBuilder");
            }
            typedConsumers.forEach((kind, handler) -> registerTyped(registry, typeResolver, kind, handler));
        }

        if (registry.isEmpty()) {
            throw new ConfigurationException("No `consumes...` method called on SubscriptionOptionsBuilder");
        }

        TableDescriptor effectiveTable = table != null ? table : TableDescriptor.defaults();
        MapperRegistry frozen = registry.freeze();
        PublicationSpec publication = new PublicationSpec(
            publicationName != null ? publicationName : PublicationSpec.DEFAULT_NAME,
            effectiveTable,
            frozen.discriminators(),
            filterByDiscriminator && !frozen.hasWildcard()
        );

        built = true;
        return new SubscriptionOptions(
            connection,
            dataSource,
            effectiveTable,
            publication,
            slot != null ? slot : ReplicationSlotSpec.defaults(),
            typeResolver,
            frozen,
            errorProcessor != null ? errorProcessor : new LoggingErrorProcessor(),
            reconnectPolicy != null ? reconnectPolicy : ReconnectPolicy.DEFAULT,
            confirmationPolicy != null ? confirmationPolicy : ConfirmationPolicy.DEFAULT,
            metrics != null ? metrics : MetricsPort.NOOP
        );
    }

    @SuppressWarnings("unchecked")
    private <T> void registerTyped(MapperRegistry registry, TypeResolver typeResolver, Class<T> kind,
                                   MessageHandler<?> handler) {
        String discriminator = typeResolver.whitelist(kind);
        registry.register(discriminator, new PayloadMapper.Typed<>(kind, jsonMapper), (MessageHandler<T>) handler);
    }

    private void claim(String discriminator) {
        if (discriminator == null || discriminator.isBlank()) {
            throw new ConfigurationException("Discriminator must not be blank");
        }
        if (rawStringConsumers.containsKey(discriminator) || rawObjectConsumers.containsKey(discriminator)) {
            String what = MapperRegistry.WILDCARD.equals(discriminator)
                ? "A wildcard consumer" : "A consumer for '" + discriminator + "'";
            throw new ConfigurationException(what + " is already registered");
        }
    }

    private static void ensureUnset(Object current, String option) {
        if (current != null) {
            throw new ConfigurationException("`" + option + "` option set more than once on SubscriptionOptionsBuilder");
        }
    }

    private static void ensureSet(Object current, String option) {
        if (current == null) {
            throw new ConfigurationException("`" + option + "` option not set on SubscriptionOptionsBuilder");
        }
    }
}
