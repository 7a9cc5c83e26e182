package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionStyle {
    PRIMARY,
    SECONDARY,
    DANGER,
    SUCCESS;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionStyle fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
