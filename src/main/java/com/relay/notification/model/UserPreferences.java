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
 * Per-user inclusion rules. Categories and types missing from the settings maps are enabled;
 * categories missing from the threshold map have no minimum priority.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-user notification preferences")
public class UserPreferences {

    @Schema(description = "Per-category enable flag", example = "{\"business\": false}")
    @Builder.Default
    private Map<NotificationCategory, Boolean> categorySettings = new EnumMap<>(NotificationCategory.class);

    @Schema(description = "Per-type enable flag", example = "{\"info\": true}")
    @Builder.Default
    private Map<NotificationType, Boolean> typeSettings = new EnumMap<>(NotificationType.class);

    @Schema(description = "Minimum priority per category", example = "{\"system\": \"high\"}")
    @Builder.Default
    private Map<NotificationCategory, NotificationPriority> priorityThresholds = new EnumMap<>(NotificationCategory.class);

    @Schema(description = "Quiet hours window")
    private QuietHours quietHours;

    @Schema(description = "Per-user hourly cap; tightens the pipeline cap when lower", example = "5")
    private Integer maxNotificationsPerHour;

    @Schema(description = "Keywords that let a notification through quiet hours", example = "[\"outage\"]")
    @Builder.Default
    private List<String> alwaysIncludeKeywords = new ArrayList<>();

    @Schema(description = "Keywords that always exclude a notification", example = "[\"newsletter\"]")
    @Builder.Default
    private List<String> alwaysExcludeKeywords = new ArrayList<>();

    public boolean isCategoryEnabled(NotificationCategory category) {
        return categorySettings == null || !Boolean.FALSE.equals(categorySettings.get(category));
    }

    public boolean isTypeEnabled(NotificationType type) {
        return typeSettings == null || !Boolean.FALSE.equals(typeSettings.get(type));
    }

    public NotificationPriority thresholdFor(NotificationCategory category) {
        return priorityThresholds != null ? priorityThresholds.get(category) : null;
    }

    /**
     * Preferences applied when a session is known but the caller sent none:
     * everything enabled, with the standard per-category priority floors.
     */
    public static UserPreferences defaults() {
        Map<NotificationCategory, NotificationPriority> thresholds = new EnumMap<>(NotificationCategory.class);
        thresholds.put(NotificationCategory.WORKFLOW, NotificationPriority.MEDIUM);
        thresholds.put(NotificationCategory.SYSTEM, NotificationPriority.HIGH);
        thresholds.put(NotificationCategory.PERFORMANCE, NotificationPriority.MEDIUM);
        thresholds.put(NotificationCategory.SECURITY, NotificationPriority.HIGH);
        thresholds.put(NotificationCategory.USER, NotificationPriority.LOW);
        thresholds.put(NotificationCategory.BUSINESS, NotificationPriority.MEDIUM);
        return UserPreferences.builder()
                .priorityThresholds(thresholds)
                .build();
    }
}
