package com.pgoutbox.application.service;

import com.pgoutbox.application.port.in.GetUserActivityUseCase;
import com.pgoutbox.domain.message.MessageKinds;
import com.pgoutbox.domain.message.UserCreated;
import com.pgoutbox.domain.message.UserDeleted;
import com.pgoutbox.domain.message.UserModified;
import com.pgoutbox.domain.message.UserSubscribed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory read model fed by the subscription handlers. Keeps per-kind counts and the latest entries.
 */
@Service
public class UserActivityProjection implements GetUserActivityUseCase {

    private static final Logger log = LoggerFactory.getLogger(UserActivityProjection.class);

    static final int MAX_ENTRIES = 1000;

    private final Clock clock;
    private final Map<String, Long> counts = new LinkedHashMap<>();
    private final Deque<ActivityEntry> recent = new ArrayDeque<>();

    public UserActivityProjection() {
        this(Clock.systemUTC());
    }

    UserActivityProjection(Clock clock) {
        this.clock = clock;
    }

    public void onUserCreated(UserCreated message) {
        record(message.id(), MessageKinds.USER_CREATED, null);
    }

    public void onUserDeleted(UserDeleted message) {
        record(message.id(), MessageKinds.USER_DELETED, null);
    }

    public void onUserModified(UserModified message) {
        record(message.id(), MessageKinds.USER_MODIFIED, message.name());
    }

    public void onUserSubscribed(UserSubscribed message) {
        record(message.id(), MessageKinds.USER_SUBSCRIBED, message.plan());
    }

    @Override
    public synchronized UserActivity getActivity(int limit) {
        List<ActivityEntry> latest = new ArrayList<>(Math.min(limit, recent.size()));
        Iterator<ActivityEntry> newestFirst = recent.descendingIterator();
        while (newestFirst.hasNext() && latest.size() < limit) {
            latest.add(newestFirst.next());
        }
        return new UserActivity(new LinkedHashMap<>(counts), latest);
    }

    public synchronized void clear() {
        counts.clear();
        recent.clear();
    }

    private synchronized void record(String userId, String kind, String detail) {
        counts.merge(kind, 1L, Long::sum);
        recent.addLast(new ActivityEntry(userId, kind, detail, clock.instant()));
        if (recent.size() > MAX_ENTRIES) {
            recent.removeFirst();
        }
        log.debug("Projected {} for user {}", kind, userId);
    }
}
