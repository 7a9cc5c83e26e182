package com.relay.notification.controller;

import com.relay.notification.exception.InvalidNotificationException;
import com.relay.notification.exception.PredictionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidNotificationException.class)
    public ResponseEntity<Map<String, String>> invalidNotification(InvalidNotificationException e) {
        return RequestValidation.badRequest(e.getMessage(), e.getField());
    }

    // Jackson wraps errors raised while binding the body
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof InvalidNotificationException invalid) {
                return invalidNotification(invalid);
            }
            current = current.getCause();
        }
        return RequestValidation.badRequest("Malformed request body", "body");
    }

    @ExceptionHandler(PredictionException.class)
    public ResponseEntity<Map<String, String>> predictionFailed(PredictionException e) {
        log.warn("Relevance predictor call failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
    }
}
