package com.pgoutbox.application.service;

import com.pgoutbox.application.port.in.PublishDemoMessagesUseCase;
import com.pgoutbox.application.port.out.IdGenerator;
import com.pgoutbox.application.port.out.OutboxAppender;
import com.pgoutbox.domain.message.MessageKinds;
import com.pgoutbox.domain.message.UserCreated;
import com.pgoutbox.domain.message.UserDeleted;
import com.pgoutbox.domain.message.UserModified;
import com.pgoutbox.domain.message.UserSubscribed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Generates sample user messages and appends them to the outbox.
 */
@Service
public class DemoPublisherService implements PublishDemoMessagesUseCase {

    private static final Logger log = LoggerFactory.getLogger(DemoPublisherService.class);

    static final int MAX_COUNT = 10_000;

    private static final List<String> PLANS = List.of("free", "basic", "premium");

    private final OutboxAppender outboxAppender;
    private final IdGenerator idGenerator;
    private final TransactionTemplate transactionTemplate;
    private final Map<String, Function<String, Object>> generators = new LinkedHashMap<>();

    public DemoPublisherService(
            OutboxAppender outboxAppender,
            IdGenerator idGenerator,
            TransactionTemplate transactionTemplate) {
        this.outboxAppender = outboxAppender;
        this.idGenerator = idGenerator;
        this.transactionTemplate = transactionTemplate;

        generators.put(MessageKinds.USER_CREATED, UserCreated::new);
        generators.put(MessageKinds.USER_DELETED, UserDeleted::new);
        generators.put(MessageKinds.USER_MODIFIED, id -> new UserModified(id, "user-" + id.substring(0, 8)));
        generators.put(MessageKinds.USER_SUBSCRIBED, id -> new UserSubscribed(id, PLANS.get(Math.floorMod(id.hashCode(), PLANS.size()))));
    }

    @Override
    public PublishedMessages publish(List<String> discriminators, int count) {
        if (count < 1 || count > MAX_COUNT) {
            throw new IllegalArgumentException("count must be between 1 and " + MAX_COUNT + ", got " + count);
        }
        List<String> kinds = discriminators == null || discriminators.isEmpty()
            ? List.copyOf(generators.keySet())
            : discriminators;
        for (String kind : kinds) {
            if (!generators.containsKey(kind)) {
                throw new IllegalArgumentException("Unknown message type '" + kind + "', expected one of " + generators.keySet());
            }
        }

        Map<String, Integer> byDiscriminator = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            String kind = kinds.get(i % kinds.size());
            Object message = generators.get(kind).apply(idGenerator.generate().toString());
            // one transaction per message, like an ordinary producer would do
            transactionTemplate.executeWithoutResult(status -> outboxAppender.append(message));
            byDiscriminator.merge(kind, 1, Integer::sum);
        }

        log.info("Published {} demo messages: {}", count, byDiscriminator);
        return new PublishedMessages(count, byDiscriminator);
    }
}
