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
@Schema(description = "Health of the platform emitting the notifications")
public class SystemContext {

    @Schema(description = "Overall status", example = "degraded")
    private SystemStatus status;

    @Schema(description = "Load between 0 and 1", example = "0.82")
    private double load;

    @Schema(description = "Memory usage between 0 and 1", example = "0.71")
    private double memoryUsage;

    @Schema(description = "Error rate between 0 and 1", example = "0.02")
    private double errorRate;
}
