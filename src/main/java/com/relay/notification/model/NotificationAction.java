package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "An action a recipient can take from the notification")
public class NotificationAction {

    @Schema(description = "Action identifier", example = "retry")
    String id;

    @Schema(description = "Button label", example = "Retry deployment")
    String label;

    @Schema(description = "Action handler key", example = "workflow.retry")
    String action;

    @Schema(description = "Rendering style", example = "primary")
    ActionStyle style;

    @Schema(description = "Whether the recipient must confirm before the action runs", example = "false")
    boolean requiresConfirmation;
}
