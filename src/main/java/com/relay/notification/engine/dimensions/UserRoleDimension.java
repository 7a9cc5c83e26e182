package com.relay.notification.engine.dimensions;

import com.relay.notification.engine.RelevanceDimension;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.UserSession;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Role/category affinity, permission match and how recently the user was active.
 */
@Component
public class UserRoleDimension implements RelevanceDimension {

    private static final long HOUR_MS = 60L * 60 * 1000;

    private final Clock clock;

    public UserRoleDimension(Clock clock) {
        this.clock = clock;
    }

    @Override
    public DimensionType getDimensionType() {
        return DimensionType.USER_ROLE;
    }

    @Override
    public double score(Notification notification, ContextSnapshot context) {
        UserSession session = context.getUserSession();
        if (session == null) {
            return 0.0;
        }

        double score = 0.0;
        NotificationCategory category = notification.getCategory();

        if (category == NotificationCategory.WORKFLOW && session.hasRole("developer")) {
            score += 0.8;
        } else if (category == NotificationCategory.SYSTEM && session.hasRole("admin")) {
            score += 0.9;
        } else if (category == NotificationCategory.BUSINESS && session.hasRole("manager")) {
            score += 0.7;
        }

        String permission = notification.getMetadata().getRequiresPermission();
        if (permission != null) {
            score += session.hasPermission(permission) ? 0.5 : -0.3;
        }

        long sinceActive = clock.millis() - session.getLastActiveAt();
        if (sinceActive < HOUR_MS) {
            score += 0.2;
        } else if (sinceActive < 24 * HOUR_MS) {
            score += 0.1;
        } else {
            score -= 0.1;
        }
        return score;
    }
}
