package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A batch of notifications with the context to filter them in")
public class FilterRequest {

    @Schema(description = "Candidate notifications")
    private List<Notification> notifications;

    @Schema(description = "Context snapshot; every part optional")
    private ContextSnapshot context;

    @Schema(description = "Optional time budget in milliseconds. When exceeded the partial result is returned.", example = "500")
    private Long timeoutMs;
}
