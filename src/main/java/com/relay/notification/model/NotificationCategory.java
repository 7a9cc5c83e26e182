package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationCategory {
    WORKFLOW,
    SYSTEM,
    PERFORMANCE,
    SECURITY,
    USER,
    BUSINESS;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationCategory fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
