package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared priority of a notification. Declaration order is the rank order:
 * CRITICAL has rank 0 and outranks everything below it.
 */
public enum NotificationPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public int rank() {
        return ordinal();
    }

    /**
     * True if this priority ranks strictly below {@code other} (e.g. LOW is worse than HIGH).
     */
    public boolean isWorseThan(NotificationPriority other) {
        return rank() > other.rank();
    }

    public boolean isAtLeast(NotificationPriority other) {
        return rank() <= other.rank();
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationPriority fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
