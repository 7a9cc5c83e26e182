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
@Schema(description = "Recent notification history and engagement of the recipient")
public class HistoricalContext {

    @Schema(description = "Notifications recently delivered to the recipient")
    @Builder.Default
    private List<Notification> recentNotifications = new ArrayList<>();

    @Schema(description = "Engagement rate per category (0-1)", example = "{\"workflow\": 0.85}")
    @Builder.Default
    private Map<NotificationCategory, Double> engagementByCategory = new EnumMap<>(NotificationCategory.class);

    @Schema(description = "Explicit per-category opt-in/opt-out", example = "{\"business\": false}")
    @Builder.Default
    private Map<NotificationCategory, Boolean> preferencesByCategory = new EnumMap<>(NotificationCategory.class);

    public int recentCount() {
        return recentNotifications != null ? recentNotifications.size() : 0;
    }

    /**
     * Engagement recorded for a category, or {@code null} when none was recorded.
     */
    public Double engagementFor(NotificationCategory category) {
        return engagementByCategory != null ? engagementByCategory.get(category) : null;
    }

    public Boolean preferenceFor(NotificationCategory category) {
        return preferencesByCategory != null ? preferencesByCategory.get(category) : null;
    }
}
