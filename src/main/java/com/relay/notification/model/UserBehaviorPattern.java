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

/**
 * Per-user profile derived from notification history. Collections are ordered
 * (hours ascending, enums in declaration order) so equal histories give equal patterns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Derived per-user behavior profile")
public class UserBehaviorPattern {

    @Schema(description = "User the profile belongs to", example = "user-17")
    private String userId;

    @Schema(description = "Hours of day with above-average notification count", example = "[9, 10, 14]")
    @Builder.Default
    private List<Integer> preferredHours = new ArrayList<>();

    @Schema(description = "Categories with above-average frequency", example = "[\"workflow\"]")
    @Builder.Default
    private List<NotificationCategory> preferredCategories = new ArrayList<>();

    @Schema(description = "Types with above-average frequency", example = "[\"error\"]")
    @Builder.Default
    private List<NotificationType> preferredTypes = new ArrayList<>();

    @Builder.Default
    private Map<NotificationCategory, EngagementPattern> engagementPatterns = new EnumMap<>(NotificationCategory.class);

    private FatigueIndicators fatigueIndicators;

    public int fatigueCount() {
        return fatigueIndicators != null ? fatigueIndicators.getRecentNotificationCount() : 0;
    }
}
