package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.relay.notification.exception.InvalidNotificationException;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over the open metadata bag of a notification.
 *
 * Recognised keys are parsed and type-checked once, when the notification enters the
 * engine. Anything else is kept verbatim in {@link #extensions}.
 */
@Value
@Builder
public class NotificationMetadata {

    public static final String REQUIRES_PERMISSION = "requiresPermission";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String PHASE = "phase";
    public static final String USER_ENGAGED = "userEngaged";
    public static final String RESPONSE_TIME_MS = "responseTimeMs";

    private static final NotificationMetadata EMPTY = NotificationMetadata.builder().build();

    String requiresPermission;
    String workflowId;
    String phase;
    Boolean userEngaged;
    Long responseTimeMs;

    @Builder.Default
    Map<String, Object> extensions = Collections.emptyMap();

    public static NotificationMetadata empty() {
        return EMPTY;
    }

    public boolean isEngaged() {
        return Boolean.TRUE.equals(userEngaged);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NotificationMetadata fromRaw(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }

        Map<String, Object> extensions = new LinkedHashMap<>(raw);
        NotificationMetadataBuilder builder = NotificationMetadata.builder()
                .requiresPermission(stringValue(extensions.remove(REQUIRES_PERMISSION), REQUIRES_PERMISSION))
                .workflowId(stringValue(extensions.remove(WORKFLOW_ID), WORKFLOW_ID))
                .phase(stringValue(extensions.remove(PHASE), PHASE))
                .userEngaged(booleanValue(extensions.remove(USER_ENGAGED)))
                .responseTimeMs(longValue(extensions.remove(RESPONSE_TIME_MS)));

        return builder.extensions(Collections.unmodifiableMap(extensions)).build();
    }

    @JsonValue
    public Map<String, Object> toRaw() {
        Map<String, Object> raw = new LinkedHashMap<>(extensions);
        if (requiresPermission != null) raw.put(REQUIRES_PERMISSION, requiresPermission);
        if (workflowId != null) raw.put(WORKFLOW_ID, workflowId);
        if (phase != null) raw.put(PHASE, phase);
        if (userEngaged != null) raw.put(USER_ENGAGED, userEngaged);
        if (responseTimeMs != null) raw.put(RESPONSE_TIME_MS, responseTimeMs);
        return raw;
    }

    private static String stringValue(Object value, String key) {
        if (value == null) return null;
        if (value instanceof String s) return s;
        throw new InvalidNotificationException("metadata." + key, "metadata." + key + " must be a string");
    }

    private static Boolean booleanValue(Object value) {
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        throw new InvalidNotificationException("metadata." + USER_ENGAGED,
                "metadata." + USER_ENGAGED + " must be a boolean");
    }

    private static Long longValue(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.longValue();
        throw new InvalidNotificationException("metadata." + RESPONSE_TIME_MS,
                "metadata." + RESPONSE_TIME_MS + " must be a number");
    }
}
