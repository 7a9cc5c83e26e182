package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Inclusion criteria for {@code RuleFilter}. A null member imposes no constraint.
 * An empty keyword list also imposes no constraint; an empty priority, category or
 * type set admits nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Deterministic inclusion criteria")
public class FilterCriteria {

    @Schema(description = "Allowed priorities", example = "[\"critical\", \"high\"]")
    private Set<NotificationPriority> priorities;

    @Schema(description = "Allowed categories", example = "[\"workflow\", \"system\"]")
    private Set<NotificationCategory> categories;

    @Schema(description = "Allowed types", example = "[\"error\", \"warning\"]")
    private Set<NotificationType> types;

    @Schema(description = "At least one keyword must appear in title or message (case-insensitive)", example = "[\"deploy\"]")
    private List<String> keywords;

    @Schema(description = "Creation-time window")
    private TimeRange timeRange;

    @Schema(description = "Per-user preference rules")
    private UserFilter userFilter;
}
