package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Contextual relevance analysis of one notification")
public class ContextScore {

    @Schema(description = "Notification scored", example = "NTF-000123")
    private String notificationId;

    @Schema(description = "Weighted relevance in [0, 1]", example = "0.64")
    private double relevance;

    @Schema(description = "Priority delta in [-1, 1]", example = "0.1")
    private double priorityAdjustment;

    @Schema(description = "Clamped sub-score per dimension")
    @Builder.Default
    private Map<DimensionType, Double> dimensionScores = new EnumMap<>(DimensionType.class);

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();

    @Builder.Default
    private List<String> opportunities = new ArrayList<>();
}
