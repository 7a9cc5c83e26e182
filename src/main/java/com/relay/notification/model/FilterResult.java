package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partition of an input batch into included and excluded notifications.
 * Every excluded id has at least one reason; included ids have none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of a deterministic rule-filter pass")
public class FilterResult {

    @Builder.Default
    private List<Notification> included = new ArrayList<>();

    @Builder.Default
    private List<Notification> excluded = new ArrayList<>();

    private FilterStatistics statistics;

    @Schema(description = "Reasons per excluded notification id")
    @Builder.Default
    private Map<String, List<String>> exclusionReasons = new LinkedHashMap<>();
}
