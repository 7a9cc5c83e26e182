package com.relay.notification.exception;

/**
 * Raised at ingress when a notification or a user preference carries a malformed value,
 * such as a recognised metadata key of the wrong type or an unreadable quiet-hours window.
 */
public class InvalidNotificationException extends RuntimeException {

    private final String field;

    public InvalidNotificationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
