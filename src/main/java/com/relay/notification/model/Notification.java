package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A candidate notification awaiting a filtering decision. Never mutated by the engine.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "A candidate notification submitted for filtering")
public class Notification {

    @Schema(description = "Unique notification identifier", example = "NTF-000123")
    String id;

    @Schema(description = "Short title", example = "Deployment failed")
    String title;

    @Schema(description = "Body text", example = "Workflow wf-42 failed during the testing phase")
    String message;

    @Schema(description = "Notification type", example = "error")
    NotificationType type;

    @Schema(description = "Notification category", example = "workflow")
    NotificationCategory category;

    @Schema(description = "Declared priority", example = "high")
    NotificationPriority priority;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    long createdAt;

    @Schema(description = "Metadata bag. Recognised keys: requiresPermission, workflowId, phase, userEngaged, responseTimeMs")
    @Builder.Default
    NotificationMetadata metadata = NotificationMetadata.empty();

    @Schema(description = "Actions offered with the notification")
    @Builder.Default
    List<NotificationAction> actions = Collections.emptyList();

    /**
     * Lower-cased title and message joined by a space, used for keyword and phrase matching.
     */
    public String searchableText() {
        String t = title != null ? title : "";
        String m = message != null ? message : "";
        return (t + " " + m).toLowerCase(Locale.ROOT);
    }

    public NotificationMetadata getMetadata() {
        return metadata != null ? metadata : NotificationMetadata.empty();
    }
}
