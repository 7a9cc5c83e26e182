package com.relay.notification.engine.gate;

import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static relevance estimate used by the rule filter's trailing gate.
 *
 * <pre>
 *   score = priorityTerm * 0.4 + categoryWeight * 0.3 + typeWeight * 0.2 + contextMatch * 0.1
 * </pre>
 * where priorityTerm is 1.0 for critical down to 0.25 for low.
 */
public class HeuristicRelevancePredictor implements RelevancePredictor {

    private static final double PRIORITY_WEIGHT = 0.4;
    private static final double CATEGORY_WEIGHT = 0.3;
    private static final double TYPE_WEIGHT = 0.2;
    private static final double CONTEXT_WEIGHT = 0.1;

    private static final Map<NotificationCategory, Double> CATEGORY_SCORES = new EnumMap<>(NotificationCategory.class);
    private static final Map<NotificationType, Double> TYPE_SCORES = new EnumMap<>(NotificationType.class);

    static {
        CATEGORY_SCORES.put(NotificationCategory.WORKFLOW, 1.0);
        CATEGORY_SCORES.put(NotificationCategory.SYSTEM, 0.9);
        CATEGORY_SCORES.put(NotificationCategory.PERFORMANCE, 0.8);
        CATEGORY_SCORES.put(NotificationCategory.SECURITY, 0.95);
        CATEGORY_SCORES.put(NotificationCategory.USER, 0.6);
        CATEGORY_SCORES.put(NotificationCategory.BUSINESS, 0.7);

        TYPE_SCORES.put(NotificationType.ERROR, 1.0);
        TYPE_SCORES.put(NotificationType.WARNING, 0.8);
        TYPE_SCORES.put(NotificationType.INFO, 0.6);
        TYPE_SCORES.put(NotificationType.SUCCESS, 0.7);
    }

    @Override
    public double predict(Notification notification, ContextSnapshot context) {
        double score = 0.0;

        NotificationPriority priority = notification.getPriority();
        if (priority != null) {
            score += (4 - priority.rank()) / 4.0 * PRIORITY_WEIGHT;
        }
        score += CATEGORY_SCORES.getOrDefault(notification.getCategory(), 0.5) * CATEGORY_WEIGHT;
        score += TYPE_SCORES.getOrDefault(notification.getType(), 0.5) * TYPE_WEIGHT;

        if (context != null) {
            score += contextMatch(notification, context) * CONTEXT_WEIGHT;
        }
        return Math.min(score, 1.0);
    }

    private double contextMatch(Notification notification, ContextSnapshot context) {
        double match = 0.0;
        if (context.getWorkflow() != null && notification.getMetadata().getWorkflowId() != null) {
            match += 0.5;
        }
        if (context.getUserSession() != null && notification.getCategory() == NotificationCategory.USER) {
            match += 0.3;
        }
        if (context.getSystem() != null && notification.getCategory() == NotificationCategory.SYSTEM) {
            match += 0.4;
        }
        return Math.min(match, 1.0);
    }
}
