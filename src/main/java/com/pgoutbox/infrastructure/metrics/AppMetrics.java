package com.pgoutbox.infrastructure.metrics;

import com.pgoutbox.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;
    private final AtomicLong confirmedLsn = new AtomicLong();

    private final Counter reconnects;
    private final Timer dispatchDuration;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reconnects = Counter.builder("outbox_subscription_reconnects_total")
            .description("Replication sessions restarted after a connection failure")
            .register(registry);

        this.dispatchDuration = Timer.builder("outbox_dispatch_duration_seconds")
            .description("Time spent mapping and handling one outbox row")
            .register(registry);

        Gauge.builder("outbox_confirmed_lsn", confirmedLsn, AtomicLong::get)
            .description("Last WAL position confirmed to the server")
            .register(registry);
    }

    @Override
    public void incrementDispatched(String discriminator) {
        Counter.builder("outbox_messages_dispatched_total")
            .description("Outbox rows delivered to a handler")
            .tag("discriminator", discriminator)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementFailures(String errorCode) {
        Counter.builder("outbox_dispatch_failures_total")
            .description("Outbox rows that failed to dispatch, by error code")
            .tag("code", errorCode)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementPublished(String discriminator) {
        Counter.builder("outbox_messages_published_total")
            .description("Rows appended to the outbox")
            .tag("discriminator", discriminator)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementReconnects() {
        reconnects.increment();
    }

    @Override
    public void recordConfirmedPosition(long lsn) {
        confirmedLsn.set(lsn);
    }

    @Override
    public void recordDispatchDuration(long nanos) {
        dispatchDuration.record(nanos, TimeUnit.NANOSECONDS);
    }
}
