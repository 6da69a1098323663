package com.pgoutbox.application.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface GetUserActivityUseCase {

    UserActivity getActivity(int limit);

    record UserActivity(Map<String, Long> countsByKind, List<ActivityEntry> recent) {}

    record ActivityEntry(String userId, String kind, String detail, Instant receivedAt) {}
}
