package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Engagement with one category")
public class EngagementPattern {

    @Schema(description = "Engaged / total for the category", example = "0.4")
    private double engagementRate;

    @Schema(description = "Mean metadata.responseTimeMs over notifications that carry it, 0 if none", example = "5400")
    private double averageResponseTimeMs;
}
