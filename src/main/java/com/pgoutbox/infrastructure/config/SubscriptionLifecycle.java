package com.pgoutbox.infrastructure.config;

import com.pgoutbox.application.subscription.OutboxSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the subscription once the context is refreshed and stops it before the DataSource closes.
 */
@Component
public class SubscriptionLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycle.class);

    private final OutboxSubscription subscription;
    private final AppProperties properties;

    public SubscriptionLifecycle(OutboxSubscription subscription, AppProperties properties) {
        this.subscription = subscription;
        this.properties = properties;
    }

    @Override
    public void start() {
        subscription.start().whenComplete((ignored, failure) -> {
            if (failure != null) {
                log.error("Outbox subscription terminated with {}", failure.getClass().getSimpleName());
            }
        });
    }

    @Override
    public void stop() {
        log.info("Stopping outbox subscription");
        subscription.stop();
    }

    @Override
    public boolean isRunning() {
        return subscription.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.getSubscription().isEnabled();
    }
}
