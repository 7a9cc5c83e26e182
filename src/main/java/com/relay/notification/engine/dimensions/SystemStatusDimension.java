package com.relay.notification.engine.dimensions;

import com.relay.notification.engine.RelevanceDimension;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.SystemContext;
import com.relay.notification.model.SystemStatus;
import org.springframework.stereotype.Component;

/**
 * Health-driven relevance. Only system and performance notifications can score here.
 */
@Component
public class SystemStatusDimension implements RelevanceDimension {

    @Override
    public DimensionType getDimensionType() {
        return DimensionType.SYSTEM_STATUS;
    }

    @Override
    public double score(Notification notification, ContextSnapshot context) {
        SystemContext system = context.getSystem();
        if (system == null) {
            return 0.0;
        }

        NotificationType type = notification.getType();
        double score = 0.0;

        if (notification.getCategory() == NotificationCategory.SYSTEM) {
            if (system.getStatus() == SystemStatus.UNHEALTHY && type == NotificationType.ERROR) {
                score += 0.9;
            } else if (system.getStatus() == SystemStatus.DEGRADED && type == NotificationType.WARNING) {
                score += 0.7;
            } else if (system.getStatus() == SystemStatus.HEALTHY && type == NotificationType.SUCCESS) {
                score += 0.6;
            }
        }

        if (notification.getCategory() == NotificationCategory.PERFORMANCE) {
            if (system.getLoad() > 0.8 && type == NotificationType.WARNING) {
                score += 0.8;
            } else if (system.getMemoryUsage() > 0.9 && type == NotificationType.ERROR) {
                score += 0.9;
            } else if (system.getErrorRate() > 0.1 && type == NotificationType.ERROR) {
                score += 0.8;
            }
        }
        return score;
    }
}
