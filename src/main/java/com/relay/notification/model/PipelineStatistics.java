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
public class PipelineStatistics {

    @Schema(description = "Notifications submitted", example = "20")
    private int total;

    @Schema(description = "Notifications delivered", example = "10")
    private int filtered;

    @Schema(description = "filtered / total, 0 when total is 0", example = "0.5")
    private double inclusionRate;

    @Schema(description = "Confidence in the decision, 0.5 after a fallback", example = "1.0")
    private double mlConfidence;
}
