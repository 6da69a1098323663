package com.pgoutbox.infrastructure.config;

import com.pgoutbox.adapter.in.replication.PgWalStreamFactory;
import com.pgoutbox.adapter.out.persistence.JdbcPublicationManager;
import com.pgoutbox.adapter.out.persistence.JdbcReplicationSlotManager;
import com.pgoutbox.adapter.out.persistence.JdbcTableConformityManager;
import com.pgoutbox.application.config.SubscriptionOptions;
import com.pgoutbox.application.subscription.OutboxSubscription;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires an {@link OutboxSubscription} to the PostgreSQL adapters. Usable without a Spring context.
 */
public final class OutboxSubscriptionFactory {

    private OutboxSubscriptionFactory() {}

    public static OutboxSubscription create(SubscriptionOptions options) {
        JdbcTemplate jdbc = new JdbcTemplate(options.dataSource());
        return new OutboxSubscription(
            options,
            new JdbcTableConformityManager(jdbc),
            new JdbcPublicationManager(jdbc),
            new JdbcReplicationSlotManager(jdbc),
            new PgWalStreamFactory(options.connection(), options.confirmationPolicy().statusInterval())
        );
    }
}
