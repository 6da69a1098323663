package com.pgoutbox.application.config;

import com.pgoutbox.application.error.ErrorProcessor;
import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.registry.MapperRegistry;
import com.pgoutbox.application.registry.TypeResolver;
import com.pgoutbox.domain.model.PublicationSpec;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.TableDescriptor;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Immutable snapshot of everything a subscription needs. Produced by {@link SubscriptionOptionsBuilder}.
 */
public record SubscriptionOptions(
    ConnectionSettings connection,
    DataSource dataSource,
    TableDescriptor table,
    PublicationSpec publication,
    ReplicationSlotSpec slot,
    TypeResolver typeResolver,
    MapperRegistry registry,
    ErrorProcessor errorProcessor,
    ReconnectPolicy reconnectPolicy,
    ConfirmationPolicy confirmationPolicy,
    MetricsPort metrics
) {

    public SubscriptionOptions {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(publication, "publication");
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(typeResolver, "typeResolver");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(errorProcessor, "errorProcessor");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(confirmationPolicy, "confirmationPolicy");
        Objects.requireNonNull(metrics, "metrics");
        if (!registry.isFrozen()) {
            throw new IllegalArgumentException("registry must be frozen");
        }
    }

    public static SubscriptionOptionsBuilder builder() {
        return new SubscriptionOptionsBuilder();
    }
}
