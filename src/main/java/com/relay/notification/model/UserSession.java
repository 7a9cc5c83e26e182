package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "The recipient's current session")
public class UserSession {

    @Schema(description = "User identifier", example = "user-17")
    private String userId;

    @Schema(description = "User role", example = "developer")
    private String role;

    @Schema(description = "Permissions held by the session", example = "[\"deploy\", \"billing.read\"]")
    @Builder.Default
    private List<String> permissions = new ArrayList<>();

    @Schema(description = "Last activity timestamp in epoch milliseconds", example = "1739886764000")
    private long lastActiveAt;

    public boolean hasRole(String candidate) {
        return role != null && role.equalsIgnoreCase(candidate);
    }

    public boolean hasPermission(String permission) {
        return permissions != null && permissions.contains(permission);
    }
}
