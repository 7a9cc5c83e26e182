package com.relay.notification.exception;

/**
 * Recoverable failure to score a single notification. The item is kept.
 */
public class PredictionException extends RuntimeException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
