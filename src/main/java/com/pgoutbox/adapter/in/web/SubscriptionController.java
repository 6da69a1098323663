package com.pgoutbox.adapter.in.web;

import com.pgoutbox.application.port.in.GetSubscriptionStatusUseCase;
import com.pgoutbox.domain.model.SubscriptionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Subscription", description = "Replication subscription status")
public class SubscriptionController {

    private final GetSubscriptionStatusUseCase getSubscriptionStatusUseCase;

    public SubscriptionController(GetSubscriptionStatusUseCase getSubscriptionStatusUseCase) {
        this.getSubscriptionStatusUseCase = getSubscriptionStatusUseCase;
    }

    @GetMapping("/subscription")
    @Operation(summary = "Get subscription status",
        description = "Returns the consumer state, the last confirmed WAL position and delivery counters")
    public ResponseEntity<SubscriptionStatusResponse> getStatus() {
        return ResponseEntity.ok(SubscriptionStatusResponse.from(getSubscriptionStatusUseCase.getStatus()));
    }

    public record SubscriptionStatusResponse(
        String state,
        String confirmedPosition,
        long dispatched,
        long failed
    ) {
        static SubscriptionStatusResponse from(SubscriptionStatus status) {
            return new SubscriptionStatusResponse(
                status.state().name(),
                status.confirmedPosition().toString(),
                status.dispatched(),
                status.failed()
            );
        }
    }
}
