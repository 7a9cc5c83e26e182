package com.relay.notification.engine.gate;

import com.relay.notification.exception.PredictionException;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;

import java.util.List;

/**
 * Scores how relevant a notification is to its recipient.
 * Implementations are swapped through configuration; none is required.
 */
public interface RelevancePredictor {

    /**
     * @return relevance in [0, 1]
     * @throws PredictionException when this one notification cannot be scored.
     *         The caller keeps the notification. Any other exception is treated
     *         as a failure of the predictor as a whole.
     */
    double predict(Notification notification, ContextSnapshot context);

    /**
     * Online-learning hook. Implementations that cannot learn ignore the call.
     */
    default void learn(List<Notification> notifications, ContextSnapshot context) {
    }
}
