package com.relay.notification.engine.dimensions;

import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.UserSession;
import com.relay.notification.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static com.relay.notification.testutil.TestDataFactory.HOUR_MS;
import static com.relay.notification.testutil.TestDataFactory.NOW;
import static com.relay.notification.testutil.TestDataFactory.createNotification;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UserRoleDimensionTest {

    private final UserRoleDimension dimension = new UserRoleDimension(TestDataFactory.fixedClock());

    @Test
    void score_noSession_zero() {
        Notification n = createNotification("N-1", NotificationPriority.HIGH, NotificationCategory.SYSTEM, NotificationType.ERROR);

        assertThat(dimension.score(n, ContextSnapshot.empty())).isEqualTo(0.0);
    }

    @Test
    void score_adminOnSystemActiveYesterday_roleBonusPlusRecency() {
        Notification n = createNotification("N-1", NotificationPriority.HIGH, NotificationCategory.SYSTEM, NotificationType.ERROR);
        UserSession session = TestDataFactory.createSession("user-1", "ADMIN");
        session.setLastActiveAt(NOW.toEpochMilli() - 5 * HOUR_MS);

        assertThat(dimension.score(n, ContextSnapshot.builder().userSession(session).build())).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void score_managerOnBusinessLongInactive_recencyPenalty() {
        Notification n = createNotification("N-1", NotificationPriority.MEDIUM, NotificationCategory.BUSINESS, NotificationType.INFO);
        UserSession session = TestDataFactory.createSession("user-1", "manager");
        session.setLastActiveAt(NOW.toEpochMilli() - 25 * HOUR_MS);

        assertThat(dimension.score(n, ContextSnapshot.builder().userSession(session).build())).isCloseTo(0.6, within(1e-9));
    }
}
