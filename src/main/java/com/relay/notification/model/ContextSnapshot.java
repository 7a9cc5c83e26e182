package com.relay.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied picture of user, workflow, system, time and history state.
 * Every sub-record is optional; an absent one contributes nothing to scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Context used to score and filter a batch of notifications")
public class ContextSnapshot {

    @Schema(description = "Recipient session")
    private UserSession userSession;

    @Schema(description = "Active workflow")
    private WorkflowContext workflow;

    @Schema(description = "Platform health")
    private SystemContext system;

    @Schema(description = "Wall-clock context")
    private TimeContext time;

    @Schema(description = "Recent history and engagement")
    private HistoricalContext history;

    @Schema(description = "Recipient's notification preferences. Defaults apply when a session is present and this is omitted.")
    private UserPreferences userPreferences;

    public static ContextSnapshot empty() {
        return new ContextSnapshot();
    }

    public String userId() {
        return userSession != null ? userSession.getUserId() : null;
    }

    @JsonIgnore
    public boolean isWeekend() {
        return time != null && time.isWeekend();
    }

    @JsonIgnore
    public boolean isBusinessHours() {
        return time != null && time.isBusinessHours();
    }

    public boolean hasRole(String role) {
        return userSession != null && userSession.hasRole(role);
    }
}
