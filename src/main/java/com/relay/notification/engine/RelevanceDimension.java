package com.relay.notification.engine;

import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.Notification;

/**
 * Interface for all relevance dimensions combined by the {@link ContextScorer}.
 * Each implementation handles a specific DimensionType.
 */
public interface RelevanceDimension {

    /**
     * The dimension this implementation scores.
     */
    DimensionType getDimensionType();

    /**
     * Raw sub-score for the notification. The scorer clamps it to [0, 1].
     * Implementations return 0 when the context sub-record they read is absent.
     *
     * @param notification the notification being scored
     * @param context      caller-supplied context; sub-records may be null
     */
    double score(Notification notification, ContextSnapshot context);
}
