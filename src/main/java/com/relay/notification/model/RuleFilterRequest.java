package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Notifications to filter against explicit criteria")
public class RuleFilterRequest {

    private List<Notification> notifications;

    @Schema(description = "Inclusion criteria; omitted members impose no constraint")
    private FilterCriteria criteria;

    @Schema(description = "Optional context used by the relevance gate")
    private ContextSnapshot context;
}
