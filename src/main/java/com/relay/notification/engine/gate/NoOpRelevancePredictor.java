package com.relay.notification.engine.gate;

import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;

/**
 * Pass-through predictor: everything is fully relevant.
 */
public class NoOpRelevancePredictor implements RelevancePredictor {

    @Override
    public double predict(Notification notification, ContextSnapshot context) {
        return 1.0;
    }
}
