package com.relay.notification.model;

import com.relay.notification.exception.InvalidNotificationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuietHoursTest {

    // 2025-02-18 is a Tuesday
    private static long at(String isoInstant) {
        return Instant.parse(isoInstant).toEpochMilli();
    }

    @Test
    void contains_windowWrappingMidnight() {
        QuietHours quiet = QuietHours.builder().start("22:00").end("07:00").build();

        assertThat(quiet.contains(at("2025-02-18T23:30:00Z"))).isTrue();
        assertThat(quiet.contains(at("2025-02-18T06:59:00Z"))).isTrue();
        assertThat(quiet.contains(at("2025-02-18T07:00:00Z"))).isFalse();
        assertThat(quiet.contains(at("2025-02-18T12:00:00Z"))).isFalse();
    }

    @Test
    void contains_evaluatedInWindowZone() {
        QuietHours quiet = QuietHours.builder().start("22:00").end("23:00").zoneId("Europe/Berlin").build();

        // 21:30 UTC is 22:30 in Berlin in winter
        assertThat(quiet.contains(at("2025-02-18T21:30:00Z"))).isTrue();
        assertThat(quiet.contains(at("2025-02-18T22:30:00Z"))).isFalse();
    }

    @Test
    void contains_restrictedDays() {
        QuietHours quiet = QuietHours.builder().start("00:00").end("23:59").days(List.of(0, 6)).build();

        assertThat(quiet.contains(at("2025-02-22T10:00:00Z"))).isTrue();
        assertThat(quiet.contains(at("2025-02-18T10:00:00Z"))).isFalse();
    }

    @Test
    void contains_disabledOrEmptyWindow_false() {
        long noon = at("2025-02-18T12:00:00Z");

        assertThat(QuietHours.builder().start("09:00").end("17:00").enabled(false).build().contains(noon)).isFalse();
        assertThat(QuietHours.builder().start("12:00").end("12:00").build().contains(noon)).isFalse();
    }

    @Test
    void setStart_malformedTime_throwsWithField() {
        QuietHours quiet = new QuietHours();

        assertThatThrownBy(() -> quiet.setStart("25:99"))
                .isInstanceOf(InvalidNotificationException.class)
                .extracting("field").isEqualTo("quietHours.start");
        assertThat(quiet.getStart()).isNull();
    }

    @Test
    void setZoneId_unknownZone_throwsWithField() {
        QuietHours quiet = new QuietHours();

        assertThatThrownBy(() -> quiet.setZoneId("Mars/Olympus"))
                .isInstanceOf(InvalidNotificationException.class)
                .extracting("field").isEqualTo("quietHours.zoneId");
        assertThat(quiet.getZoneId()).isNotEqualTo("Mars/Olympus");
    }

    @Test
    void setDays_outOfRange_throws() {
        QuietHours quiet = new QuietHours();

        assertThatThrownBy(() -> quiet.setDays(List.of(1, 7)))
                .isInstanceOf(InvalidNotificationException.class)
                .extracting("field").isEqualTo("quietHours.days");
    }

    @Test
    void validate_builtWithMalformedEnd_throws() {
        QuietHours quiet = QuietHours.builder().start("22:00").end("7pm").build();

        assertThatThrownBy(quiet::validate)
                .isInstanceOf(InvalidNotificationException.class)
                .extracting("field").isEqualTo("quietHours.end");
    }

    @Test
    void contains_builtWithMalformedStart_throwsInvalidNotification() {
        QuietHours quiet = QuietHours.builder().start("25:99").end("07:00").build();

        assertThatThrownBy(() -> quiet.contains(at("2025-02-18T12:00:00Z")))
                .isInstanceOf(InvalidNotificationException.class)
                .hasMessageContaining("25:99");
    }
}
