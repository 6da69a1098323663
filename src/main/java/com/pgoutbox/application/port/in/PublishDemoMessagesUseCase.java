package com.pgoutbox.application.port.in;

import java.util.List;
import java.util.Map;

public interface PublishDemoMessagesUseCase {

    /**
     * Appends {@code count} sample messages, cycling through {@code discriminators}, one transaction per message.
     */
    PublishedMessages publish(List<String> discriminators, int count);

    record PublishedMessages(int total, Map<String, Integer> byDiscriminator) {}
}
