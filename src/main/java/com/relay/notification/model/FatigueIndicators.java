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
@Schema(description = "Signals of notification overload")
public class FatigueIndicators {

    @Schema(description = "Notifications created in the trailing 24 hours", example = "14")
    private int recentNotificationCount;

    @Schema(description = "Mean gap between consecutive notifications in milliseconds", example = "360000")
    private double averageTimeBetweenNotificationsMs;

    @Schema(description = "createdAt of the most recent engaged notification, 0 if none", example = "1739886764000")
    private long lastEngagementAt;
}
