package com.relay.notification.engine.dimensions;

import com.relay.notification.engine.RelevanceDimension;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.Notification;
import com.relay.notification.model.TimeContext;
import org.springframework.stereotype.Component;

@Component
public class TimeContextDimension implements RelevanceDimension {

    @Override
    public DimensionType getDimensionType() {
        return DimensionType.TIME_CONTEXT;
    }

    @Override
    public double score(Notification notification, ContextSnapshot context) {
        TimeContext time = context.getTime();
        if (time == null) {
            return 0.0;
        }

        double score = 0.0;
        if (time.isBusinessHours()) {
            score += 0.3;
        } else if (time.isWeekend()) {
            score -= 0.2;
        }

        int hour = time.getHour();
        if (hour >= 9 && hour <= 17) {
            score += 0.2;
        } else if (hour >= 18 && hour <= 22) {
            score += 0.1;
        } else {
            score -= 0.1;
        }

        score += time.isWeekday() ? 0.1 : -0.1;
        return score;
    }
}
