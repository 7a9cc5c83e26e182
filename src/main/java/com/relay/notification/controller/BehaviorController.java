package com.relay.notification.controller;

import com.relay.notification.engine.ContextScorer;
import com.relay.notification.model.Notification;
import com.relay.notification.model.UserBehaviorPattern;
import com.relay.notification.service.FilterPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/behavior")
@Tag(name = "Behavior", description = "Per-user behavior patterns and the pipeline's behavior cache")
public class BehaviorController {

    private final FilterPipeline filterPipeline;
    private final ContextScorer contextScorer;

    public BehaviorController(FilterPipeline filterPipeline, ContextScorer contextScorer) {
        this.filterPipeline = filterPipeline;
        this.contextScorer = contextScorer;
    }

    @Operation(summary = "Analyze a notification history",
            description = "Derives preferred hours, categories and types, engagement and fatigue from the given history. " +
                    "Pure computation: the cache is not touched.")
    @PostMapping("/{userId}/analyze")
    public ResponseEntity<?> analyze(
            @Parameter(description = "User ID", example = "user-17")
            @PathVariable String userId,
            @RequestBody List<Notification> history) {
        ResponseEntity<Map<String, String>> problem = RequestValidation.checkNotifications(history, "history");
        if (problem != null) return problem;

        return ResponseEntity.ok(contextScorer.analyzeBehavior(userId, history));
    }

    @Operation(summary = "Get the cached behavior pattern of a user")
    @GetMapping("/{userId}")
    public ResponseEntity<UserBehaviorPattern> getCached(
            @Parameter(description = "User ID", example = "user-17")
            @PathVariable String userId) {
        return filterPipeline.getCachedBehavior(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Evict one user's cached behavior pattern")
    @DeleteMapping("/cache/{userId}")
    public ResponseEntity<Void> clearUser(
            @Parameter(description = "User ID", example = "user-17")
            @PathVariable String userId) {
        filterPipeline.clearBehaviorCache(userId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Evict every cached behavior pattern")
    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearAll() {
        filterPipeline.clearBehaviorCache(null);
        return ResponseEntity.noContent().build();
    }
}
