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
@Schema(description = "The workflow the recipient is currently engaged in")
public class WorkflowContext {

    @Schema(description = "Workflow identifier", example = "wf-42")
    private String workflowId;

    @Schema(description = "Current phase", example = "testing")
    private String phase;

    @Schema(description = "Workflow status", example = "running")
    private String status;

    @Schema(description = "Progress between 0 and 1", example = "0.65")
    private double progress;

    public boolean hasStatus(String candidate) {
        return status != null && status.equalsIgnoreCase(candidate);
    }
}
