package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a full pipeline run")
public class PipelineResult {

    @Schema(description = "Delivered notifications ordered by priority then creation time")
    @Builder.Default
    private List<Notification> notifications = new ArrayList<>();

    private PipelineStatistics statistics;

    @Schema(description = "Human-readable reasons per excluded notification id")
    @Builder.Default
    private Map<String, List<String>> explanations = new LinkedHashMap<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Schema(description = "True when the result did not come from a complete run", example = "false")
    private boolean degraded;

    @Schema(description = "How the run ended", example = "FULL")
    private FilterMode mode;

    @Schema(description = "Last stage that completed", example = "explain")
    private PipelineStage completedStage;
}
