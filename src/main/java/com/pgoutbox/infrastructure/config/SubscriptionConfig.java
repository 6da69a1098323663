package com.pgoutbox.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgoutbox.adapter.out.persistence.JdbcOutboxAppender;
import com.pgoutbox.application.config.ConfirmationPolicy;
import com.pgoutbox.application.config.ConnectionSettings;
import com.pgoutbox.application.config.ReconnectPolicy;
import com.pgoutbox.application.config.SubscriptionOptions;
import com.pgoutbox.application.error.ErrorDirective;
import com.pgoutbox.application.error.LoggingErrorProcessor;
import com.pgoutbox.application.port.out.IdGenerator;
import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.registry.NamingPolicy;
import com.pgoutbox.application.registry.TypeResolver;
import com.pgoutbox.application.service.UserActivityProjection;
import com.pgoutbox.application.subscription.OutboxSubscription;
import com.pgoutbox.domain.message.MessageKinds;
import com.pgoutbox.domain.message.UserCreated;
import com.pgoutbox.domain.message.UserDeleted;
import com.pgoutbox.domain.message.UserModified;
import com.pgoutbox.domain.message.UserSubscribed;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.ConfigurationException;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Locale;

/**
 * Builds the subscription from {@code outbox.*} properties and the application's {@link DataSource}.
 */
@Configuration
public class SubscriptionConfig {

    @Bean
    public TableDescriptor outboxTable(AppProperties properties) {
        AppProperties.Table table = properties.getTable();
        return TableDescriptor.defaults()
            .withSchema(table.getSchema())
            .withName(table.getName())
            .withColumns(table.getIdColumn(), table.getDiscriminatorColumn(), table.getPayloadColumn(), table.getCreatedAtColumn());
    }

    @Bean
    public NamingPolicy namingPolicy() {
        return NamingPolicy.explicit(MessageKinds.discriminators());
    }

    /**
     * Resolver used on the producing side; whitelists every user message kind.
     */
    @Bean
    public TypeResolver publisherTypeResolver(NamingPolicy namingPolicy) {
        TypeResolver resolver = new TypeResolver(namingPolicy);
        MessageKinds.discriminators().keySet().forEach(resolver::whitelist);
        return resolver;
    }

    @Bean
    public JdbcOutboxAppender outboxAppender(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            IdGenerator idGenerator,
            TypeResolver publisherTypeResolver,
            TableDescriptor outboxTable,
            MetricsPort metrics) {
        return new JdbcOutboxAppender(jdbcTemplate, objectMapper, idGenerator, publisherTypeResolver, outboxTable, metrics);
    }

    @Bean
    public SubscriptionOptions subscriptionOptions(
            AppProperties properties,
            DataSource dataSource,
            DataSourceProperties dataSourceProperties,
            ObjectMapper objectMapper,
            NamingPolicy namingPolicy,
            TableDescriptor outboxTable,
            MetricsPort metrics,
            UserActivityProjection projection) {
        AppProperties.Stream stream = properties.getStream();
        AppProperties.Reconnect reconnect = properties.getReconnect();
        AppProperties.Slot slot = properties.getSlot();

        return SubscriptionOptions.builder()
            .connection(new ConnectionSettings(
                dataSourceProperties.determineUrl(),
                dataSourceProperties.determineUsername(),
                dataSourceProperties.determinePassword()))
            .dataSource(dataSource)
            .table(outboxTable)
            .namingPolicy(namingPolicy)
            .jsonMapper(objectMapper)
            .publication(properties.getPublication().getName(), properties.getPublication().isFilterByDiscriminator())
            .replicationSlot(slot.isTemporary()
                ? ReplicationSlotSpec.temporary(slot.getName())
                : ReplicationSlotSpec.durable(slot.getName()))
            .errorProcessor(new LoggingErrorProcessor(handlerFailureDirective(properties.getErrors())))
            .reconnectPolicy(new ReconnectPolicy(
                reconnect.getMaxAttempts(),
                Duration.ofMillis(reconnect.getInitialBackoffMs()),
                reconnect.getMultiplier(),
                Duration.ofMillis(reconnect.getMaxBackoffMs())))
            .confirmationPolicy(new ConfirmationPolicy(
                stream.getConfirmBatchSize(),
                Duration.ofMillis(stream.getConfirmIntervalMs()),
                Duration.ofMillis(stream.getPollIntervalMs()),
                Duration.ofMillis(stream.getStatusIntervalMs())))
            .metrics(metrics)
            .consumes(UserCreated.class, projection::onUserCreated)
            .consumes(UserDeleted.class, projection::onUserDeleted)
            .consumes(UserModified.class, projection::onUserModified)
            .consumes(UserSubscribed.class, projection::onUserSubscribed)
            .build();
    }

    @Bean
    public OutboxSubscription outboxSubscription(SubscriptionOptions subscriptionOptions) {
        return OutboxSubscriptionFactory.create(subscriptionOptions);
    }

    static ErrorDirective handlerFailureDirective(AppProperties.Errors errors) {
        ErrorDirective terminal = terminalDirective(errors.getOnRetryExhausted(), "on-retry-exhausted");
        String value = errors.getOnHandlerFailure().toLowerCase(Locale.ROOT);
        if (value.equals("retry")) {
            return ErrorDirective.retry(errors.getRetryAttempts(), Duration.ofMillis(errors.getRetryBackoffMs()), terminal);
        }
        return terminalDirective(value, "on-handler-failure");
    }

    private static ErrorDirective terminalDirective(String value, String property) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "abort" -> ErrorDirective.abort();
            case "skip", "continue" -> ErrorDirective.skip();
            default -> throw new ConfigurationException(
                "outbox.errors." + property + " must be abort or skip, got '" + value + "'");
        };
    }
}
