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
@Schema(description = "Inclusive creation-time window in epoch milliseconds")
public class TimeRange {

    @Schema(description = "Window start (inclusive)", example = "1739880000000")
    private long start;

    @Schema(description = "Window end (inclusive)", example = "1739886764000")
    private long end;

    public boolean contains(long epochMillis) {
        return epochMillis >= start && epochMillis <= end;
    }
}
