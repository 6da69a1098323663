package com.pgoutbox.adapter.in.web;

import com.pgoutbox.application.port.in.GetUserActivityUseCase;
import com.pgoutbox.application.port.in.GetUserActivityUseCase.UserActivity;
import com.pgoutbox.application.port.in.PublishDemoMessagesUseCase;
import com.pgoutbox.application.port.in.PublishDemoMessagesUseCase.PublishedMessages;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/demo")
@Tag(name = "Demo", description = "Sample producer and the read model fed by the subscription")
public class DemoController {

    private static final int MAX_ACTIVITY = 100;

    private final PublishDemoMessagesUseCase publishDemoMessagesUseCase;
    private final GetUserActivityUseCase getUserActivityUseCase;

    public DemoController(
            PublishDemoMessagesUseCase publishDemoMessagesUseCase,
            GetUserActivityUseCase getUserActivityUseCase) {
        this.publishDemoMessagesUseCase = publishDemoMessagesUseCase;
        this.getUserActivityUseCase = getUserActivityUseCase;
    }

    @PostMapping("/messages")
    @Operation(summary = "Publish sample messages",
        description = "Appends messages to the outbox, cycling through the given types; all types when none are given")
    public ResponseEntity<PublishedMessages> publish(@Valid @RequestBody PublishRequest request) {
        PublishedMessages published = publishDemoMessagesUseCase.publish(request.types(), request.count());
        return ResponseEntity.status(HttpStatus.CREATED).body(published);
    }

    @GetMapping("/activity")
    @Operation(summary = "Get projected user activity", description = "Returns per-type counts and the latest projected messages")
    public ResponseEntity<UserActivity> getActivity(
            @Parameter(description = "Number of recent entries to return (max 100)")
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? Math.max(0, Math.min(limit, MAX_ACTIVITY)) : 20;
        return ResponseEntity.ok(getUserActivityUseCase.getActivity(effectiveLimit));
    }

    public record PublishRequest(
        List<String> types,
        @Min(1) @Max(10_000) int count
    ) {}
}
