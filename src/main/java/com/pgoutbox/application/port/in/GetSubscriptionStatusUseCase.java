package com.pgoutbox.application.port.in;

import com.pgoutbox.domain.model.SubscriptionStatus;

public interface GetSubscriptionStatusUseCase {
    SubscriptionStatus getStatus();
}
