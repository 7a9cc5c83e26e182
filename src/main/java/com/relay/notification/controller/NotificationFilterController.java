package com.relay.notification.controller;

import com.relay.notification.engine.ContextScorer;
import com.relay.notification.engine.RuleFilter;
import com.relay.notification.model.ContextScore;
import com.relay.notification.model.FilterRequest;
import com.relay.notification.model.FilterResult;
import com.relay.notification.model.PipelineResult;
import com.relay.notification.model.RuleFilterRequest;
import com.relay.notification.model.ScoreRequest;
import com.relay.notification.service.FilterPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/notifications")
@Tag(name = "Notifications", description = "Filter, score and prioritize notification batches")
public class NotificationFilterController {

    private final FilterPipeline filterPipeline;
    private final RuleFilter ruleFilter;
    private final ContextScorer contextScorer;
    private final Clock clock;

    public NotificationFilterController(FilterPipeline filterPipeline,
                                        RuleFilter ruleFilter,
                                        ContextScorer contextScorer,
                                        Clock clock) {
        this.filterPipeline = filterPipeline;
        this.ruleFilter = ruleFilter;
        this.contextScorer = contextScorer;
        this.clock = clock;
    }

    @Operation(summary = "Run the full filter pipeline",
            description = "Applies rule, context, prediction, behavior and rate-limit stages. Returns delivered " +
                    "notifications ordered by priority then creation time, explanations for every excluded " +
                    "notification and aggregate recommendations. Never fails because of an internal stage error.")
    @PostMapping("/filter")
    public ResponseEntity<?> filter(@RequestBody FilterRequest request) {
        ResponseEntity<Map<String, String>> problem = RequestValidation.checkNotifications(request.getNotifications(), "notifications");
        if (problem != null) return problem;
        if (request.getTimeoutMs() != null && request.getTimeoutMs() <= 0) {
            return RequestValidation.badRequest("timeoutMs must be > 0", "timeoutMs");
        }

        Instant deadline = request.getTimeoutMs() != null
                ? clock.instant().plusMillis(request.getTimeoutMs())
                : null;
        PipelineResult result = filterPipeline.filter(request.getNotifications(), request.getContext(), deadline);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Filter against explicit criteria",
            description = "Deterministic rule filtering only. Every failing criterion is reported per excluded notification.")
    @PostMapping("/rule-filter")
    public ResponseEntity<?> ruleFilter(@RequestBody RuleFilterRequest request) {
        ResponseEntity<Map<String, String>> problem = RequestValidation.checkNotifications(request.getNotifications(), "notifications");
        if (problem != null) return problem;

        FilterResult result = ruleFilter.filter(request.getNotifications(), request.getCriteria(), request.getContext());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Score one notification in context",
            description = "Returns relevance, priority adjustment, per-dimension sub-scores, recommendations, " +
                    "risk factors and opportunities.")
    @PostMapping("/score")
    public ResponseEntity<?> score(@RequestBody ScoreRequest request) {
        ResponseEntity<Map<String, String>> problem = RequestValidation.checkNotification(request.getNotification(), "notification");
        if (problem != null) return problem;

        ContextScore score = contextScorer.score(request.getNotification(), request.getContext());
        return ResponseEntity.ok(score);
    }

    @Operation(summary = "Submit notifications for online learning",
            description = "Forwards the batch to the relevance predictor when ML and adaptive filtering are both enabled.")
    @PostMapping("/model-updates")
    public ResponseEntity<?> updateModel(@RequestBody FilterRequest request) {
        ResponseEntity<Map<String, String>> problem = RequestValidation.checkNotifications(request.getNotifications(), "notifications");
        if (problem != null) return problem;

        boolean applied = filterPipeline.updateModel(request.getNotifications(), request.getContext());
        return ResponseEntity.accepted().body(Map.of(
                "applied", applied,
                "notifications", request.getNotifications().size()));
    }
}
