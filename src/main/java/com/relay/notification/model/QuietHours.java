package com.relay.notification.model;

import com.relay.notification.exception.InvalidNotificationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Daily window during which non-override notifications are suppressed")
public class QuietHours {

    @Schema(description = "Whether the window is active", example = "true")
    @Builder.Default
    private boolean enabled = true;

    @Schema(description = "Window start, HH:MM", example = "22:00")
    private String start;

    @Schema(description = "Window end (exclusive), HH:MM. May be earlier than start to wrap midnight.", example = "07:00")
    private String end;

    @Schema(description = "Zone the window is expressed in", example = "Europe/Berlin")
    @Builder.Default
    private String zoneId = "UTC";

    @Schema(description = "Days the window applies to, 0 = Sunday through 6 = Saturday. Empty means every day.", example = "[1,2,3,4,5]")
    @Builder.Default
    private List<Integer> days = new ArrayList<>();

    public void setStart(String start) {
        if (start != null) parseTime(start, "start");
        this.start = start;
    }

    public void setEnd(String end) {
        if (end != null) parseTime(end, "end");
        this.end = end;
    }

    public void setZoneId(String zoneId) {
        if (zoneId != null) parseZone(zoneId);
        this.zoneId = zoneId;
    }

    public void setDays(List<Integer> days) {
        if (days != null) {
            for (Integer day : days) {
                if (day == null || day < 0 || day > 6) {
                    throw new InvalidNotificationException("quietHours.days",
                            "quietHours.days must hold values from 0 (Sunday) to 6 (Saturday)");
                }
            }
        }
        this.days = days;
    }

    /**
     * Checks a window built in code; JSON input is checked as it is bound.
     *
     * @throws InvalidNotificationException naming the first malformed field
     */
    public void validate() {
        if (start != null) parseTime(start, "start");
        if (end != null) parseTime(end, "end");
        if (zoneId != null) parseZone(zoneId);
        setDays(days);
    }

    /**
     * Whether the given instant falls inside the window, in the window's own zone.
     *
     * @throws InvalidNotificationException when the window holds a malformed time or zone
     */
    public boolean contains(long epochMillis) {
        if (!enabled || start == null || end == null) {
            return false;
        }
        ZonedDateTime at = Instant.ofEpochMilli(epochMillis).atZone(zoneId != null ? parseZone(zoneId) : ZoneOffset.UTC);
        if (days != null && !days.isEmpty() && !days.contains(at.getDayOfWeek().getValue() % 7)) {
            return false;
        }

        int minute = at.getHour() * 60 + at.getMinute();
        int startMinute = toMinuteOfDay(parseTime(start, "start"));
        int endMinute = toMinuteOfDay(parseTime(end, "end"));

        if (startMinute == endMinute) {
            return false;
        }
        if (startMinute < endMinute) {
            return minute >= startMinute && minute < endMinute;
        }
        // wraps midnight
        return minute >= startMinute || minute < endMinute;
    }

    private static int toMinuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    private static LocalTime parseTime(String hhmm, String field) {
        try {
            return LocalTime.parse(hhmm.trim());
        } catch (DateTimeException e) {
            throw new InvalidNotificationException("quietHours." + field,
                    "quietHours." + field + " must be a time of day as HH:MM, got '" + hhmm + "'");
        }
    }

    private static ZoneId parseZone(String zoneId) {
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            throw new InvalidNotificationException("quietHours.zoneId",
                    "quietHours.zoneId is not a known zone: '" + zoneId + "'");
        }
    }
}
