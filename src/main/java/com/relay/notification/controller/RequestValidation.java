package com.relay.notification.controller;

import com.relay.notification.model.Notification;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

final class RequestValidation {

    private RequestValidation() {
    }

    /**
     * First problem with a batch of notifications as a 400 response, or null when the batch is usable.
     */
    static ResponseEntity<Map<String, String>> checkNotifications(List<Notification> notifications, String field) {
        if (notifications == null) {
            return badRequest(field + " is required", field);
        }
        for (int i = 0; i < notifications.size(); i++) {
            ResponseEntity<Map<String, String>> problem = checkNotification(notifications.get(i), field + "[" + i + "]");
            if (problem != null) {
                return problem;
            }
        }
        return null;
    }

    static ResponseEntity<Map<String, String>> checkNotification(Notification n, String field) {
        if (n == null) return badRequest(field + " is required", field);
        if (n.getId() == null || n.getId().isBlank()) return badRequest(field + ".id is required", field + ".id");
        if (n.getType() == null) return badRequest(field + ".type is required", field + ".type");
        if (n.getCategory() == null) return badRequest(field + ".category is required", field + ".category");
        if (n.getPriority() == null) return badRequest(field + ".priority is required", field + ".priority");
        return null;
    }

    static ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
