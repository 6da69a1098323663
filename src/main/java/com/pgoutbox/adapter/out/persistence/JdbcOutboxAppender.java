package com.pgoutbox.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgoutbox.application.port.out.IdGenerator;
import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.port.out.OutboxAppender;
import com.pgoutbox.application.registry.TypeResolver;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.infrastructure.exception.ConfigurationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Inserts messages into the outbox table through the caller's {@link JdbcTemplate}, so the row
 * commits or rolls back with the surrounding business transaction.
 */
public class JdbcOutboxAppender implements OutboxAppender {

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final IdGenerator idGenerator;
    private final TypeResolver typeResolver;
    private final MetricsPort metrics;
    private final String insertSql;
    private final TableDescriptor table;

    public JdbcOutboxAppender(
            JdbcTemplate jdbc,
            ObjectMapper objectMapper,
            IdGenerator idGenerator,
            TypeResolver typeResolver,
            TableDescriptor table,
            MetricsPort metrics) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.idGenerator = idGenerator;
        this.typeResolver = typeResolver;
        this.table = table;
        this.metrics = metrics;
        this.insertSql = "INSERT INTO " + table.qualifiedName() + " ("
            + table.id().quotedName() + ", "
            + table.discriminator().quotedName() + ", "
            + table.payload().quotedName() + ", "
            + table.createdAt().quotedName()
            + ") VALUES (?, ?, ?::" + table.payload().baseType() + ", ?)";
    }

    @Override
    public UUID append(Object message) {
        String discriminator = typeResolver.discriminatorOf(message.getClass())
            .orElseThrow(() -> new ConfigurationException(
                "Message kind " + message.getClass().getName() + " is not whitelisted for publishing"));
        try {
            return appendRaw(discriminator, objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + message.getClass().getSimpleName(), e);
        }
    }

    @Override
    public UUID appendRaw(String discriminator, String jsonPayload) {
        UUID id = idGenerator.generate();
        jdbc.update(
            insertSql,
            id,
            discriminator,
            jsonPayload,
            Timestamp.from(Instant.ofEpochMilli(idGenerator.extractTimestamp(id)))
        );
        metrics.incrementPublished(discriminator);
        return id;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table.qualifiedName(), Long.class);
        return count != null ? count : 0;
    }

    @Override
    public void deleteAll() {
        jdbc.update("DELETE FROM " + table.qualifiedName());
    }
}
