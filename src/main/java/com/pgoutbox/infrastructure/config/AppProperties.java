package com.pgoutbox.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "outbox")
public class AppProperties {

    private Table table = new Table();
    private Publication publication = new Publication();
    private Slot slot = new Slot();
    private Stream stream = new Stream();
    private Reconnect reconnect = new Reconnect();
    private Errors errors = new Errors();
    private Subscription subscription = new Subscription();

    public Table getTable() {
        return table;
    }

    public void setTable(Table table) {
        this.table = table;
    }

    public Publication getPublication() {
        return publication;
    }

    public void setPublication(Publication publication) {
        this.publication = publication;
    }

    public Slot getSlot() {
        return slot;
    }

    public void setSlot(Slot slot) {
        this.slot = slot;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect;
    }

    public Errors getErrors() {
        return errors;
    }

    public void setErrors(Errors errors) {
        this.errors = errors;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public void setSubscription(Subscription subscription) {
        this.subscription = subscription;
    }

    public static class Table {
        private String schema = "public";
        private String name = "outbox";
        private String idColumn = "id";
        private String discriminatorColumn = "message_type";
        private String payloadColumn = "data";
        private String createdAtColumn = "created_at";

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getDiscriminatorColumn() {
            return discriminatorColumn;
        }

        public void setDiscriminatorColumn(String discriminatorColumn) {
            this.discriminatorColumn = discriminatorColumn;
        }

        public String getPayloadColumn() {
            return payloadColumn;
        }

        public void setPayloadColumn(String payloadColumn) {
            this.payloadColumn = payloadColumn;
        }

        public String getCreatedAtColumn() {
            return createdAtColumn;
        }

        public void setCreatedAtColumn(String createdAtColumn) {
            this.createdAtColumn = createdAtColumn;
        }
    }

    public static class Publication {
        private String name = "outbox_pub";
        private boolean filterByDiscriminator;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isFilterByDiscriminator() {
            return filterByDiscriminator;
        }

        public void setFilterByDiscriminator(boolean filterByDiscriminator) {
            this.filterByDiscriminator = filterByDiscriminator;
        }
    }

    public static class Slot {
        private String name = "outbox_slot";
        private boolean temporary;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isTemporary() {
            return temporary;
        }

        public void setTemporary(boolean temporary) {
            this.temporary = temporary;
        }
    }

    public static class Stream {
        private int confirmBatchSize = 100;
        private long confirmIntervalMs = 1000;
        private long pollIntervalMs = 10;
        private long statusIntervalMs = 10000;

        public int getConfirmBatchSize() {
            return confirmBatchSize;
        }

        public void setConfirmBatchSize(int confirmBatchSize) {
            this.confirmBatchSize = confirmBatchSize;
        }

        public long getConfirmIntervalMs() {
            return confirmIntervalMs;
        }

        public void setConfirmIntervalMs(long confirmIntervalMs) {
            this.confirmIntervalMs = confirmIntervalMs;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getStatusIntervalMs() {
            return statusIntervalMs;
        }

        public void setStatusIntervalMs(long statusIntervalMs) {
            this.statusIntervalMs = statusIntervalMs;
        }
    }

    public static class Reconnect {
        private int maxAttempts = 5;
        private long initialBackoffMs = 500;
        private double multiplier = 2.0;
        private long maxBackoffMs = 30000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    public static class Errors {
        private String onHandlerFailure = "abort";
        private int retryAttempts = 3;
        private long retryBackoffMs = 200;
        private String onRetryExhausted = "abort";

        public String getOnHandlerFailure() {
            return onHandlerFailure;
        }

        public void setOnHandlerFailure(String onHandlerFailure) {
            this.onHandlerFailure = onHandlerFailure;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public String getOnRetryExhausted() {
            return onRetryExhausted;
        }

        public void setOnRetryExhausted(String onRetryExhausted) {
            this.onRetryExhausted = onRetryExhausted;
        }
    }

    public static class Subscription {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
