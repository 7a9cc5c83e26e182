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
@Schema(description = "Counts for a single rule-filter pass")
public class FilterStatistics {

    @Schema(description = "Notifications examined", example = "12")
    private int total;

    @Schema(description = "Notifications included", example = "9")
    private int included;

    @Schema(description = "Notifications excluded", example = "3")
    private int excluded;

    @Schema(description = "included / total, 0 when total is 0", example = "0.75")
    private double inclusionRate;

    public static FilterStatistics of(int included, int excluded) {
        int total = included + excluded;
        return new FilterStatistics(total, included, excluded, total > 0 ? (double) included / total : 0.0);
    }
}
