package com.relay.notification.engine.dimensions;

import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.SystemContext;
import com.relay.notification.model.SystemStatus;
import org.junit.jupiter.api.Test;

import static com.relay.notification.testutil.TestDataFactory.createNotification;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SystemStatusDimensionTest {

    private final SystemStatusDimension dimension = new SystemStatusDimension();

    @Test
    void score_degradedSystemWarning_boosted() {
        Notification n = createNotification("N-1", NotificationPriority.HIGH, NotificationCategory.SYSTEM, NotificationType.WARNING);
        ContextSnapshot ctx = ContextSnapshot.builder()
                .system(SystemContext.builder().status(SystemStatus.DEGRADED).build())
                .build();

        assertThat(dimension.score(n, ctx)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void score_highLoadPerformanceWarning_boosted() {
        Notification n = createNotification("N-1", NotificationPriority.HIGH, NotificationCategory.PERFORMANCE, NotificationType.WARNING);
        ContextSnapshot ctx = ContextSnapshot.builder()
                .system(SystemContext.builder().status(SystemStatus.HEALTHY).load(0.85).build())
                .build();

        assertThat(dimension.score(n, ctx)).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void score_unrelatedCategory_zero() {
        Notification n = createNotification("N-1", NotificationPriority.HIGH, NotificationCategory.USER, NotificationType.ERROR);
        ContextSnapshot ctx = ContextSnapshot.builder()
                .system(SystemContext.builder().status(SystemStatus.UNHEALTHY).load(0.99).build())
                .build();

        assertThat(dimension.score(n, ctx)).isEqualTo(0.0);
    }
}
