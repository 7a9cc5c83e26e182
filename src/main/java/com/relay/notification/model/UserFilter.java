package com.relay.notification.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "User-preference block of a filter criteria")
public class UserFilter {

    @Schema(description = "User the preferences belong to", example = "user-17")
    private String userId;

    @Schema(description = "The user's preferences")
    private UserPreferences preferences;
}
