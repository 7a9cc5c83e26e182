package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Wall-clock context of the recipient")
public class TimeContext {

    @Schema(description = "Hour of day (0-23)", example = "14")
    private int hour;

    @Schema(description = "Day of week, 0 = Sunday through 6 = Saturday", example = "3")
    private int dayOfWeek;

    @Schema(description = "Whether the recipient is within business hours", example = "true")
    private boolean businessHours;

    @Schema(description = "Whether it is the weekend for the recipient", example = "false")
    private boolean weekend;

    /**
     * Derives the time context for a zoned instant. Business hours are 09:00-17:59 on weekdays.
     */
    public static TimeContext of(ZonedDateTime at) {
        DayOfWeek dow = at.getDayOfWeek();
        boolean weekend = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
        int hour = at.getHour();
        return TimeContext.builder()
                .hour(hour)
                .dayOfWeek(dow.getValue() % 7)
                .weekend(weekend)
                .businessHours(!weekend && hour >= 9 && hour <= 17)
                .build();
    }

    @JsonIgnore
    public boolean isWeekday() {
        return dayOfWeek >= 1 && dayOfWeek <= 5;
    }
}
