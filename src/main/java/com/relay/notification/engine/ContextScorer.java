package com.relay.notification.engine;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.model.ContextScore;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.EngagementPattern;
import com.relay.notification.model.FatigueIndicators;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.SystemStatus;
import com.relay.notification.model.UserBehaviorPattern;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scores the contextual relevance of a single notification and derives per-user behavior profiles.
 * Uses the Strategy pattern: each DimensionType is scored by a registered RelevanceDimension and
 * the clamped sub-scores are combined with configurable weights.
 */
@Component
public class ContextScorer {

    private static final Logger log = LoggerFactory.getLogger(ContextScorer.class);

    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private static final Map<NotificationPriority, Double> PRIORITY_BASE_ADJUSTMENT = new EnumMap<>(NotificationPriority.class);

    static {
        PRIORITY_BASE_ADJUSTMENT.put(NotificationPriority.CRITICAL, 0.0);
        PRIORITY_BASE_ADJUSTMENT.put(NotificationPriority.HIGH, 0.1);
        PRIORITY_BASE_ADJUSTMENT.put(NotificationPriority.MEDIUM, 0.2);
        PRIORITY_BASE_ADJUSTMENT.put(NotificationPriority.LOW, 0.3);
    }

    private final Map<DimensionType, RelevanceDimension> dimensionMap;
    private final Map<DimensionType, Double> weights;
    private final FilterPipelineProperties.Thresholds thresholds;
    private final Clock clock;
    private final ZoneId zone;

    public ContextScorer(List<RelevanceDimension> dimensions, FilterPipelineProperties properties, Clock clock) {
        this.dimensionMap = new EnumMap<>(DimensionType.class);
        this.thresholds = properties.getThresholds();
        this.clock = clock;
        this.zone = properties.zone();

        for (RelevanceDimension dimension : dimensions) {
            dimensionMap.put(dimension.getDimensionType(), dimension);
            log.info("Registered relevance dimension: {} -> {}",
                    dimension.getDimensionType(), dimension.getClass().getSimpleName());
        }

        FilterPipelineProperties.Weights w = properties.getWeights();
        this.weights = new EnumMap<>(DimensionType.class);
        weights.put(DimensionType.USER_ROLE, w.getUserRole());
        weights.put(DimensionType.WORKFLOW_PHASE, w.getWorkflowPhase());
        weights.put(DimensionType.SYSTEM_STATUS, w.getSystemStatus());
        weights.put(DimensionType.TIME_CONTEXT, w.getTimeContext());
        weights.put(DimensionType.HISTORICAL_PATTERNS, w.getHistoricalPatterns());
    }

    /**
     * Analyze one notification against the context.
     *
     * relevance = Σ clamp(dimensionScore) × weight, clamped to [0, 1].
     * A dimension whose context sub-record is absent scores 0.
     */
    @Observed(name = "context.score", contextualName = "score-notification")
    public ContextScore score(Notification notification, ContextSnapshot context) {
        ContextSnapshot ctx = context != null ? context : ContextSnapshot.empty();

        Map<DimensionType, Double> subScores = new EnumMap<>(DimensionType.class);
        double relevance = 0.0;
        for (DimensionType type : DimensionType.values()) {
            RelevanceDimension dimension = dimensionMap.get(type);
            double sub = dimension != null ? clamp(dimension.score(notification, ctx), 0.0, 1.0) : 0.0;
            subScores.put(type, sub);
            relevance += sub * weights.get(type);
        }

        return ContextScore.builder()
                .notificationId(notification.getId())
                .relevance(clamp(relevance, 0.0, 1.0))
                .priorityAdjustment(priorityAdjustment(notification, ctx))
                .dimensionScores(subScores)
                .recommendations(recommendations(notification, ctx))
                .riskFactors(riskFactors(notification, ctx))
                .opportunities(opportunities(notification, ctx))
                .build();
    }

    /**
     * Derive a behavior profile from notification history. Depends only on the history
     * and the current time (for the trailing 24h fatigue window).
     */
    public UserBehaviorPattern analyzeBehavior(String userId, List<Notification> history) {
        List<Notification> items = history != null ? history : List.of();

        return UserBehaviorPattern.builder()
                .userId(userId)
                .preferredHours(preferredHours(items))
                .preferredCategories(aboveAverage(items, NotificationCategory.class, Notification::getCategory))
                .preferredTypes(aboveAverage(items, NotificationType.class, Notification::getType))
                .engagementPatterns(engagementPatterns(items))
                .fatigueIndicators(fatigue(items))
                .build();
    }

    double priorityAdjustment(Notification n, ContextSnapshot ctx) {
        double adjustment = PRIORITY_BASE_ADJUSTMENT.getOrDefault(n.getPriority(), 0.0);

        if (ctx.hasRole("admin") && n.getCategory() == NotificationCategory.SYSTEM) {
            adjustment += 0.2;
        }
        if (ctx.getWorkflow() != null && ctx.getWorkflow().hasStatus("failed") && n.getType() == NotificationType.ERROR) {
            adjustment += 0.3;
        }
        if (ctx.getSystem() != null && ctx.getSystem().getStatus() == SystemStatus.UNHEALTHY
                && n.getCategory() == NotificationCategory.SYSTEM) {
            adjustment += 0.4;
        }
        if (ctx.isWeekend() && n.getPriority() == NotificationPriority.LOW) {
            adjustment -= 0.2;
        }
        return clamp(adjustment, -1.0, 1.0);
    }

    private List<String> recommendations(Notification n, ContextSnapshot ctx) {
        List<String> out = new ArrayList<>();
        if (ctx.hasRole("developer") && n.getCategory() == NotificationCategory.WORKFLOW) {
            out.add("Consider showing this notification prominently as it relates to active development work");
        }
        if (ctx.getWorkflow() != null && "testing".equals(ctx.getWorkflow().getPhase()) && n.getType() == NotificationType.ERROR) {
            out.add("This error notification is highly relevant during the testing phase");
        }
        if (ctx.getSystem() != null && ctx.getSystem().getStatus() == SystemStatus.UNHEALTHY
                && n.getCategory() == NotificationCategory.SYSTEM) {
            out.add("System is unhealthy - prioritize this notification for immediate attention");
        }
        if (ctx.isWeekend() && n.getPriority() == NotificationPriority.LOW) {
            out.add("Consider delaying this notification until business hours");
        }
        if (ctx.getHistory() != null) {
            Double engagement = ctx.getHistory().engagementFor(n.getCategory());
            if (engagement != null && engagement < thresholds.getLowEngagement()) {
                out.add("User has low engagement with this category - consider alternative notification approach");
            }
        }
        return out;
    }

    private List<String> riskFactors(Notification n, ContextSnapshot ctx) {
        List<String> out = new ArrayList<>();
        if (ctx.getHistory() != null && ctx.getHistory().recentCount() > thresholds.getRiskVolume()) {
            out.add("High notification volume may cause user fatigue");
        }
        if (n.getPriority() == NotificationPriority.CRITICAL && ctx.isWeekend()) {
            out.add("Critical notification during off hours may not be noticed");
        }
        if (ctx.getSystem() != null && ctx.getSystem().getLoad() > 0.9 && n.getCategory() == NotificationCategory.PERFORMANCE) {
            out.add("System is overloaded - additional notifications may worsen the situation");
        }
        if (ctx.getUserSession() != null && clock.millis() - ctx.getUserSession().getLastActiveAt() > DAY_MS) {
            out.add("User has been inactive for over 24 hours - notification may not be seen");
        }
        return out;
    }

    private List<String> opportunities(Notification n, ContextSnapshot ctx) {
        List<String> out = new ArrayList<>();
        if (ctx.getHistory() != null) {
            Double engagement = ctx.getHistory().engagementFor(n.getCategory());
            if (engagement != null && engagement > thresholds.getHighEngagement()) {
                out.add("User has high engagement with this category - good opportunity for interaction");
            }
        }
        if (ctx.getWorkflow() != null && ctx.getWorkflow().getProgress() > 0.9 && n.getType() == NotificationType.SUCCESS) {
            out.add("Workflow is nearly complete - good time for celebration notification");
        }
        if (ctx.getSystem() != null && ctx.getSystem().getStatus() == SystemStatus.HEALTHY
                && n.getCategory() == NotificationCategory.SYSTEM) {
            out.add("System is healthy - good time for positive reinforcement");
        }
        if (ctx.isBusinessHours() && n.getPriority() == NotificationPriority.MEDIUM) {
            out.add("Business hours - good time for non-critical notifications");
        }
        return out;
    }

    private List<Integer> preferredHours(List<Notification> items) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (Notification n : items) {
            int hour = Instant.ofEpochMilli(n.getCreatedAt()).atZone(zone).getHour();
            counts.merge(hour, 1, Integer::sum);
        }
        double average = items.size() / 24.0;
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > average)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    // Buckets whose count is strictly above the mean over the buckets that occur at all
    private static <E extends Enum<E>> List<E> aboveAverage(List<Notification> items, Class<E> type,
                                                            Function<Notification, E> key) {
        Map<E, Integer> counts = new EnumMap<>(type);
        for (Notification n : items) {
            E bucket = key.apply(n);
            if (bucket != null) {
                counts.merge(bucket, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return new ArrayList<>();
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        double average = (double) total / counts.size();
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > average)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static Map<NotificationCategory, EngagementPattern> engagementPatterns(List<Notification> items) {
        Map<NotificationCategory, int[]> tallies = new EnumMap<>(NotificationCategory.class);
        Map<NotificationCategory, List<Long>> responseTimes = new EnumMap<>(NotificationCategory.class);

        for (Notification n : items) {
            if (n.getCategory() == null) continue;
            int[] tally = tallies.computeIfAbsent(n.getCategory(), c -> new int[2]);
            tally[0]++;
            if (n.getMetadata().isEngaged()) {
                tally[1]++;
                Long responseTime = n.getMetadata().getResponseTimeMs();
                if (responseTime != null) {
                    responseTimes.computeIfAbsent(n.getCategory(), c -> new ArrayList<>()).add(responseTime);
                }
            }
        }

        Map<NotificationCategory, EngagementPattern> patterns = new EnumMap<>(NotificationCategory.class);
        tallies.forEach((category, tally) -> {
            List<Long> times = responseTimes.getOrDefault(category, List.of());
            double meanResponse = times.isEmpty() ? 0.0
                    : times.stream().mapToLong(Long::longValue).average().orElse(0.0);
            patterns.put(category, new EngagementPattern((double) tally[1] / tally[0], meanResponse));
        });
        return patterns;
    }

    private FatigueIndicators fatigue(List<Notification> items) {
        long dayAgo = clock.millis() - DAY_MS;
        int recent = (int) items.stream().filter(n -> n.getCreatedAt() >= dayAgo).count();

        List<Long> times = items.stream()
                .map(Notification::getCreatedAt)
                .sorted()
                .collect(Collectors.toList());
        double averageGap = 0.0;
        if (times.size() > 1) {
            averageGap = (double) (times.get(times.size() - 1) - times.get(0)) / (times.size() - 1);
        }

        long lastEngagement = items.stream()
                .filter(n -> n.getMetadata().isEngaged())
                .max(Comparator.comparingLong(Notification::getCreatedAt))
                .map(Notification::getCreatedAt)
                .orElse(0L);

        return new FatigueIndicators(recent, averageGap, lastEngagement);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
