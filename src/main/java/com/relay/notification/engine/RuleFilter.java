package com.relay.notification.engine;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.engine.gate.DuplicateDetector;
import com.relay.notification.engine.gate.RelevancePredictor;
import com.relay.notification.engine.gate.SpamDetector;
import com.relay.notification.exception.InvalidNotificationException;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.FilterCriteria;
import com.relay.notification.model.FilterResult;
import com.relay.notification.model.FilterStatistics;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.UserPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic criteria-driven filtering plus priority-aware rate limiting.
 *
 * A notification is tested against every criterion and all failures are reported.
 * Within the user-preference block and within the trailing relevance/duplicate/spam
 * gate the first failure decides. The gate only runs for notifications that passed
 * everything else.
 */
@Component
public class RuleFilter {

    private static final Logger log = LoggerFactory.getLogger(RuleFilter.class);

    static final long ONE_HOUR_MS = 60L * 60 * 1000;

    /** Priority rank ascending, then oldest first. */
    public static final Comparator<Notification> DELIVERY_ORDER =
            Comparator.comparingInt((Notification n) -> n.getPriority().rank())
                    .thenComparingLong(Notification::getCreatedAt);

    private final RelevancePredictor gatePredictor;
    private final DuplicateDetector duplicateDetector;
    private final SpamDetector spamDetector;
    private final double gateMinRelevance;
    private final Clock clock;

    public RuleFilter(@Qualifier("gate") RelevancePredictor gatePredictor,
                      DuplicateDetector duplicateDetector,
                      SpamDetector spamDetector,
                      FilterPipelineProperties properties,
                      Clock clock) {
        this.gatePredictor = gatePredictor;
        this.duplicateDetector = duplicateDetector;
        this.spamDetector = spamDetector;
        this.gateMinRelevance = properties.getThresholds().getGateMinRelevance();
        this.clock = clock;
    }

    public FilterResult filter(List<Notification> notifications, FilterCriteria criteria) {
        return filter(notifications, criteria, ContextSnapshot.empty());
    }

    /**
     * Partition {@code notifications} into included and excluded sets.
     *
     * @param context used only by the relevance gate; may be empty
     */
    public FilterResult filter(List<Notification> notifications, FilterCriteria criteria, ContextSnapshot context) {
        FilterCriteria effective = criteria != null ? criteria : new FilterCriteria();
        ContextSnapshot ctx = context != null ? context : ContextSnapshot.empty();

        List<Notification> included = new ArrayList<>();
        List<Notification> excluded = new ArrayList<>();
        Map<String, List<String>> reasons = new LinkedHashMap<>();

        for (Notification notification : notifications) {
            List<String> failures = criteriaFailures(notification, effective);

            if (effective.getUserFilter() != null && effective.getUserFilter().getPreferences() != null) {
                String preferenceFailure = preferenceFailure(notification, effective.getUserFilter().getPreferences());
                if (preferenceFailure != null) {
                    failures.add(preferenceFailure);
                }
            }

            if (failures.isEmpty()) {
                String gateFailure = gateFailure(notification, ctx);
                if (gateFailure != null) {
                    failures.add(gateFailure);
                }
            }

            if (failures.isEmpty()) {
                included.add(notification);
            } else {
                excluded.add(notification);
                reasons.computeIfAbsent(notification.getId(), id -> new ArrayList<>()).addAll(failures);
            }
        }

        log.debug("Rule filter: {} in, {} included, {} excluded",
                notifications.size(), included.size(), excluded.size());

        return FilterResult.builder()
                .included(included)
                .excluded(excluded)
                .statistics(FilterStatistics.of(included.size(), excluded.size()))
                .exclusionReasons(reasons)
                .build();
    }

    /**
     * Notifications at or above {@code maxPriority} in the order critical, high, medium, low.
     */
    public List<Notification> filterByPriority(List<Notification> notifications, NotificationPriority maxPriority) {
        return notifications.stream()
                .filter(n -> n.getPriority().isAtLeast(maxPriority))
                .collect(Collectors.toList());
    }

    /**
     * Sorts by delivery order. When more than {@code maxPerHour} notifications were created
     * within the last hour, only the first {@code maxPerHour} of the sorted list are kept.
     */
    public List<Notification> applyRateLimit(List<Notification> notifications, int maxPerHour) {
        if (maxPerHour < 0) {
            throw new IllegalArgumentException("maxPerHour must be >= 0, was " + maxPerHour);
        }
        List<Notification> sorted = new ArrayList<>(notifications);
        sorted.sort(DELIVERY_ORDER);

        long hourAgo = clock.millis() - ONE_HOUR_MS;
        long recent = sorted.stream().filter(n -> n.getCreatedAt() >= hourAgo).count();
        if (recent <= maxPerHour) {
            return sorted;
        }

        log.debug("Rate limit hit: {} created in the last hour, keeping {} of {}", recent, maxPerHour, sorted.size());
        return new ArrayList<>(sorted.subList(0, Math.min(maxPerHour, sorted.size())));
    }

    private List<String> criteriaFailures(Notification n, FilterCriteria criteria) {
        List<String> failures = new ArrayList<>();

        if (criteria.getPriorities() != null && !criteria.getPriorities().contains(n.getPriority())) {
            failures.add("Priority " + code(n.getPriority()) + " is not in the allowed priorities");
        }
        if (criteria.getCategories() != null && !criteria.getCategories().contains(n.getCategory())) {
            failures.add("Category " + code(n.getCategory()) + " is not in the allowed categories");
        }
        if (criteria.getTypes() != null && !criteria.getTypes().contains(n.getType())) {
            failures.add("Type " + code(n.getType()) + " is not in the allowed types");
        }
        if (criteria.getKeywords() != null && !criteria.getKeywords().isEmpty()
                && firstMatch(n, criteria.getKeywords()) == null) {
            failures.add("Does not match any keyword");
        }
        if (criteria.getTimeRange() != null && !criteria.getTimeRange().contains(n.getCreatedAt())) {
            failures.add("Created outside the requested time range");
        }
        return failures;
    }

    private String preferenceFailure(Notification n, UserPreferences prefs) {
        if (!prefs.isCategoryEnabled(n.getCategory())) {
            return "Category " + code(n.getCategory()) + " is disabled in user preferences";
        }
        if (!prefs.isTypeEnabled(n.getType())) {
            return "Type " + code(n.getType()) + " is disabled in user preferences";
        }

        NotificationPriority threshold = prefs.thresholdFor(n.getCategory());
        if (threshold != null && n.getPriority().isWorseThan(threshold)) {
            return "Priority " + code(n.getPriority()) + " is below the user threshold "
                    + threshold.code() + " for category " + code(n.getCategory());
        }

        String excludedBy = firstMatch(n, prefs.getAlwaysExcludeKeywords());
        if (excludedBy != null) {
            return "Matches always-exclude keyword '" + excludedBy + "'";
        }

        if (inQuietHours(n, prefs) && firstMatch(n, prefs.getAlwaysIncludeKeywords()) == null) {
            return "Created during quiet hours";
        }
        return null;
    }

    // A malformed window disables the quiet-hours rule only; the other preferences still apply.
    private boolean inQuietHours(Notification n, UserPreferences prefs) {
        if (prefs.getQuietHours() == null) {
            return false;
        }
        try {
            return prefs.getQuietHours().contains(n.getCreatedAt());
        } catch (InvalidNotificationException e) {
            log.warn("Ignoring quiet hours for notification {}: {}", n.getId(), e.getMessage());
            return false;
        }
    }

    private String gateFailure(Notification n, ContextSnapshot context) {
        double relevance = gatePredictor.predict(n, context);
        if (relevance < gateMinRelevance) {
            return String.format(Locale.ROOT, "Relevance %.2f is below the minimum %.2f", relevance, gateMinRelevance);
        }
        if (duplicateDetector.isDuplicate(n)) {
            return "Duplicate notification";
        }
        if (spamDetector.isSpam(n)) {
            return "Detected as spam";
        }
        return null;
    }

    private static String firstMatch(Notification n, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return null;
        }
        String text = n.searchableText();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isEmpty() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return keyword;
            }
        }
        return null;
    }

    private static String code(Object value) {
        if (value == null) return "none";
        return value.toString().toLowerCase(Locale.ROOT);
    }
}
