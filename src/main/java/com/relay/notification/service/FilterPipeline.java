package com.relay.notification.service;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.config.MetricsConfig;
import com.relay.notification.engine.ContextScorer;
import com.relay.notification.engine.RuleFilter;
import com.relay.notification.engine.gate.RelevancePredictor;
import com.relay.notification.exception.PredictionException;
import com.relay.notification.exception.StageFailureException;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.FilterCriteria;
import com.relay.notification.model.FilterMode;
import com.relay.notification.model.FilterResult;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.PipelineResult;
import com.relay.notification.model.PipelineStage;
import com.relay.notification.model.PipelineStatistics;
import com.relay.notification.model.UserBehaviorPattern;
import com.relay.notification.model.UserFilter;
import com.relay.notification.model.UserPreferences;
import com.relay.notification.repository.BehaviorStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Main orchestrator for notification filtering.
 *
 * Flow:
 * 1. Rule stage: criteria derived from the context, then {@link RuleFilter#filter}
 * 2. Context stage: keep notifications whose relevance reaches the confidence threshold
 * 3. Prediction stage (optional): injected {@link RelevancePredictor}, fanned out with a per-item timeout
 * 4. Behavior stage (optional): the user's cached behavior pattern and fatigue gate
 * 5. Rate limit: {@link RuleFilter#applyRateLimit}
 * 6. Explanations for every excluded notification and aggregate recommendations
 *
 * A failure in stages 1-5 switches the run to rule-only filtering of the original input.
 * The per-user behavior cache is the only mutable state and is owned by this instance.
 */
@Service
public class FilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(FilterPipeline.class);

    public static final String FALLBACK_RECOMMENDATION = "ML filtering unavailable - using basic filtering";
    static final double FALLBACK_CONFIDENCE = 0.5;

    private final RuleFilter ruleFilter;
    private final ContextScorer contextScorer;
    private final FilterPipelineProperties properties;
    private final RelevancePredictor predictor;
    private final BehaviorCache behaviorCache;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final AsyncTaskExecutor predictionExecutor;

    public FilterPipeline(RuleFilter ruleFilter,
                          ContextScorer contextScorer,
                          FilterPipelineProperties properties,
                          @Qualifier("stage") Optional<RelevancePredictor> predictor,
                          Optional<BehaviorStore> behaviorStore,
                          @Qualifier("prediction") AsyncTaskExecutor predictionExecutor,
                          Tracer tracer,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        properties.validate();

        this.ruleFilter = ruleFilter;
        this.contextScorer = contextScorer;
        this.properties = properties;
        this.predictor = predictor.orElse(null);
        this.behaviorCache = new BehaviorCache(properties.getBehaviorCacheCapacity(), behaviorStore.orElse(null));
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.predictionExecutor = predictionExecutor;

        metricsConfig.bindBehaviorCache(behaviorCache.nativeCache());
        log.info("Filter pipeline ready: ml={}, context={}, behavior={}, adaptive={}, predictor={}, maxPerHour={}",
                properties.isEnableMlFiltering(), properties.isEnableContextFiltering(),
                properties.isEnableBehaviorAnalysis(), properties.isEnableAdaptiveFiltering(),
                this.predictor != null ? this.predictor.getClass().getSimpleName() : "none",
                properties.getMaxNotificationsPerHour());
    }

    public PipelineResult filter(List<Notification> notifications, ContextSnapshot context) {
        return filter(notifications, context, null);
    }

    /**
     * Filter a batch. Never throws for a stage failure.
     *
     * @param deadline optional; checked between stages together with the thread's interrupt flag.
     *                 When reached, the result of the last completed stage is returned as PARTIAL.
     */
    @Observed(name = "pipeline.filter", contextualName = "filter-notifications")
    public PipelineResult filter(List<Notification> notifications, ContextSnapshot context, Instant deadline) {
        Run run = new Run(notifications != null ? new ArrayList<>(notifications) : new ArrayList<>(),
                context != null ? context : ContextSnapshot.empty());

        try {
            List<PipelineStage> stages = enabledStages();
            for (PipelineStage stage : stages) {
                if (cancelled(deadline)) {
                    return partial(run);
                }
                run.current = runStage(stage, run.current, in -> apply(stage, in, run));
                run.completed = stage;
            }
        } catch (StageFailureException e) {
            return fallback(run, e);
        }

        List<Notification> delivered = run.current;
        PipelineResult result = PipelineResult.builder()
                .notifications(delivered)
                .statistics(statistics(run.input.size(), delivered.size(), mlConfidence(delivered, run)))
                .explanations(explain(run, delivered))
                .recommendations(recommend(run, delivered))
                .degraded(false)
                .mode(FilterMode.FULL)
                .completedStage(PipelineStage.EXPLAIN)
                .build();

        metricsConfig.recordRun(FilterMode.FULL.name(), delivered.size());
        log.debug("Pipeline delivered {} of {} notifications for user {}",
                delivered.size(), run.input.size(), run.ctx.userId());
        return result;
    }

    /**
     * Online-learning hook. Runs only when both ML and adaptive filtering are enabled and a
     * predictor is configured; never called from {@link #filter}.
     *
     * @return true if the predictor was asked to learn
     */
    public boolean updateModel(List<Notification> notifications, ContextSnapshot context) {
        if (!properties.isEnableMlFiltering() || !properties.isEnableAdaptiveFiltering()) {
            log.debug("Model update skipped: ml={}, adaptive={}",
                    properties.isEnableMlFiltering(), properties.isEnableAdaptiveFiltering());
            return false;
        }
        if (predictor == null) {
            log.debug("Model update skipped: no relevance predictor configured");
            return false;
        }
        predictor.learn(notifications, context != null ? context : ContextSnapshot.empty());
        log.info("Model updated with {} notifications", notifications.size());
        return true;
    }

    /**
     * Remove the cached pattern for {@code userId}, or every cached pattern when it is null.
     */
    public void clearBehaviorCache(String userId) {
        if (userId == null) {
            behaviorCache.invalidateAll();
            log.info("Cleared behavior cache");
        } else {
            behaviorCache.invalidate(userId);
            log.info("Cleared cached behavior pattern for {}", userId);
        }
    }

    public Optional<UserBehaviorPattern> getCachedBehavior(String userId) {
        return behaviorCache.getIfPresent(userId);
    }

    public long behaviorCacheSize() {
        return behaviorCache.size();
    }

    /**
     * Criteria the rule stage applies for this context. Business hours admit medium priority
     * and info/success types; admins also see low priority and performance; managers see business.
     */
    public FilterCriteria buildCriteria(ContextSnapshot ctx) {
        Set<NotificationPriority> priorities = EnumSet.of(NotificationPriority.CRITICAL, NotificationPriority.HIGH);
        Set<NotificationCategory> categories = EnumSet.of(NotificationCategory.WORKFLOW, NotificationCategory.SYSTEM,
                NotificationCategory.SECURITY, NotificationCategory.USER);
        Set<NotificationType> types = EnumSet.of(NotificationType.ERROR, NotificationType.WARNING);

        if (ctx.isBusinessHours()) {
            priorities.add(NotificationPriority.MEDIUM);
            types.add(NotificationType.INFO);
            types.add(NotificationType.SUCCESS);
        }
        if (ctx.hasRole("admin")) {
            priorities.add(NotificationPriority.LOW);
            categories.add(NotificationCategory.PERFORMANCE);
        }
        if (ctx.hasRole("manager")) {
            categories.add(NotificationCategory.BUSINESS);
        }

        UserPreferences prefs = ctx.getUserPreferences();
        if (prefs == null && ctx.getUserSession() != null) {
            prefs = UserPreferences.defaults();
        }

        return FilterCriteria.builder()
                .priorities(priorities)
                .categories(categories)
                .types(types)
                .userFilter(prefs != null ? new UserFilter(ctx.userId(), prefs) : null)
                .build();
    }

    // ── Stages ──

    private List<PipelineStage> enabledStages() {
        List<PipelineStage> stages = new ArrayList<>();
        stages.add(PipelineStage.RULE);
        if (properties.isEnableContextFiltering()) stages.add(PipelineStage.CONTEXT);
        if (properties.isEnableMlFiltering()) stages.add(PipelineStage.PREDICTION);
        if (properties.isEnableBehaviorAnalysis()) stages.add(PipelineStage.BEHAVIOR);
        stages.add(PipelineStage.RATE_LIMIT);
        return stages;
    }

    private List<Notification> apply(PipelineStage stage, List<Notification> in, Run run) {
        switch (stage) {
            case RULE:
                return ruleStage(in, run);
            case CONTEXT:
                return contextStage(in, run);
            case PREDICTION:
                return predictionStage(in, run);
            case BEHAVIOR:
                return behaviorStage(in, run);
            case RATE_LIMIT:
                return rateLimitStage(in, run);
            default:
                throw new IllegalStateException("Not a filtering stage: " + stage);
        }
    }

    private List<Notification> runStage(PipelineStage stage, List<Notification> in, UnaryOperator<List<Notification>> body) {
        Span span = tracer.nextSpan()
                .name("pipeline.stage." + stage.code())
                .tag("stage.input", String.valueOf(in.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Notification> out = body.apply(in);
            span.tag("stage.output", String.valueOf(out.size()));
            metricsConfig.recordStageExcluded(stage.code(), in.size() - out.size());
            log.debug("Stage {}: {} in, {} out", stage.code(), in.size(), out.size());
            return out;
        } catch (StageFailureException e) {
            span.error(e);
            metricsConfig.recordStageFailure(stage.code());
            throw e;
        } catch (RuntimeException e) {
            span.error(e);
            metricsConfig.recordStageFailure(stage.code());
            throw new StageFailureException(stage, e);
        } finally {
            span.end();
        }
    }

    private List<Notification> ruleStage(List<Notification> in, Run run) {
        FilterResult result = ruleFilter.filter(in, buildCriteria(run.ctx), run.ctx);
        result.getExclusionReasons().forEach(run::excludeAll);
        return result.getIncluded();
    }

    private List<Notification> contextStage(List<Notification> in, Run run) {
        double threshold = properties.getMinConfidenceThreshold();
        List<Notification> kept = new ArrayList<>();
        for (Notification n : in) {
            double relevance = run.relevance(n);
            if (relevance >= threshold) {
                kept.add(n);
            } else {
                run.exclude(n.getId(), String.format(Locale.ROOT,
                        "Context relevance %.2f is below the threshold %.2f", relevance, threshold));
            }
        }
        return kept;
    }

    private List<Notification> predictionStage(List<Notification> in, Run run) {
        if (predictor == null) {
            log.debug("No relevance predictor configured, prediction stage passes {} through", in.size());
            return in;
        }

        List<Future<Double>> futures = new ArrayList<>(in.size());
        for (Notification n : in) {
            futures.add(predictionExecutor.submit(() -> predictor.predict(n, run.ctx)));
        }

        double threshold = properties.getMinConfidenceThreshold();
        long timeoutMs = properties.getPredictorTimeoutMs();
        List<Notification> kept = new ArrayList<>(in.size());

        for (int i = 0; i < in.size(); i++) {
            Notification n = in.get(i);
            Future<Double> future = futures.get(i);
            try {
                double score = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                if (score >= threshold) {
                    kept.add(n);
                    metricsConfig.recordPredictorOutcome("kept");
                } else {
                    run.exclude(n.getId(), String.format(Locale.ROOT,
                            "Low relevance score from ML analysis (%.2f)", score));
                    metricsConfig.recordPredictorOutcome("excluded");
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Relevance prediction for {} timed out after {}ms, keeping it", n.getId(), timeoutMs);
                metricsConfig.recordPredictorOutcome("timeout");
                kept.add(n);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PredictionException) {
                    log.warn("Relevance prediction failed for {}, keeping it: {}", n.getId(), cause.getMessage());
                    metricsConfig.recordPredictorOutcome("error");
                    kept.add(n);
                } else {
                    cancelFrom(futures, i + 1);
                    throw new StageFailureException(PipelineStage.PREDICTION, cause != null ? cause : e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(futures, i);
                kept.addAll(in.subList(i, in.size()));
                break;
            }
        }
        return kept;
    }

    private List<Notification> behaviorStage(List<Notification> in, Run run) {
        String userId = run.ctx.userId();
        if (userId == null) {
            return in;
        }

        List<Notification> history = run.ctx.getHistory() != null && run.ctx.getHistory().getRecentNotifications() != null
                ? run.ctx.getHistory().getRecentNotifications()
                : Collections.emptyList();
        UserBehaviorPattern pattern = behaviorCache.getOrCompute(userId,
                () -> contextScorer.analyzeBehavior(userId, history));
        run.pattern = pattern;

        boolean fatigued = pattern.fatigueCount() > properties.getMaxNotificationsPerHour();
        List<Notification> kept = new ArrayList<>();
        for (Notification n : in) {
            if (!pattern.getPreferredCategories().isEmpty() && !pattern.getPreferredCategories().contains(n.getCategory())) {
                run.exclude(n.getId(), "User has low engagement with this category");
            } else if (!pattern.getPreferredTypes().isEmpty() && !pattern.getPreferredTypes().contains(n.getType())) {
                run.exclude(n.getId(), "Type " + n.getType().code() + " is outside the user's preferred types");
            } else if (fatigued && !n.getPriority().isAtLeast(NotificationPriority.HIGH)) {
                run.exclude(n.getId(), "User is fatigued (" + pattern.fatigueCount()
                        + " notifications in the last 24h); only critical and high priority are delivered");
            } else {
                kept.add(n);
            }
        }
        return kept;
    }

    private List<Notification> rateLimitStage(List<Notification> in, Run run) {
        int cap = effectiveRateLimit(run.ctx);
        List<Notification> kept = ruleFilter.applyRateLimit(in, cap);
        if (kept.size() < in.size()) {
            Set<Notification> keptSet = Collections.newSetFromMap(new IdentityHashMap<>());
            keptSet.addAll(kept);
            for (Notification n : in) {
                if (!keptSet.contains(n)) {
                    run.exclude(n.getId(), "Exceeded the hourly limit of " + cap + " notifications");
                }
            }
        }
        return kept;
    }

    private int effectiveRateLimit(ContextSnapshot ctx) {
        int cap = properties.getMaxNotificationsPerHour();
        UserPreferences prefs = ctx.getUserPreferences();
        if (prefs != null && prefs.getMaxNotificationsPerHour() != null
                && prefs.getMaxNotificationsPerHour() >= 0 && prefs.getMaxNotificationsPerHour() < cap) {
            cap = prefs.getMaxNotificationsPerHour();
        }
        return cap;
    }

    // ── Terminal states ──

    private PipelineResult fallback(Run run, StageFailureException failure) {
        log.error("Stage {} failed, falling back to rule filtering for {} notifications",
                failure.getStage().code(), run.input.size(), failure);

        List<Notification> delivered;
        Map<String, List<String>> explanations;
        PipelineStage completed;
        try {
            FilterResult basic = ruleFilter.filter(run.input, buildCriteria(run.ctx), run.ctx);
            delivered = basic.getIncluded();
            explanations = basic.getExclusionReasons();
            completed = PipelineStage.RULE;
        } catch (RuntimeException e) {
            log.error("Rule filtering failed during fallback, returning {} notifications unfiltered", run.input.size(), e);
            delivered = run.input;
            explanations = new LinkedHashMap<>();
            completed = null;
        }

        List<String> recommendations = new ArrayList<>();
        recommendations.add(FALLBACK_RECOMMENDATION);

        metricsConfig.recordRun(FilterMode.FALLBACK.name(), delivered.size());
        return PipelineResult.builder()
                .notifications(delivered)
                .statistics(statistics(run.input.size(), delivered.size(), FALLBACK_CONFIDENCE))
                .explanations(explanations)
                .recommendations(recommendations)
                .degraded(true)
                .mode(FilterMode.FALLBACK)
                .completedStage(completed)
                .build();
    }

    private PipelineResult partial(Run run) {
        String after = run.completed != null ? run.completed.code() : "start";
        log.warn("Pipeline cancelled after {} stage, returning {} of {} notifications",
                after, run.current.size(), run.input.size());

        List<Notification> delivered = run.current;
        List<String> recommendations = recommend(run, delivered);
        recommendations.add("Filtering deadline exceeded after " + after + " stage - result is partial");

        metricsConfig.recordRun(FilterMode.PARTIAL.name(), delivered.size());
        return PipelineResult.builder()
                .notifications(delivered)
                .statistics(statistics(run.input.size(), delivered.size(), mlConfidence(delivered, run)))
                .explanations(explain(run, delivered))
                .recommendations(recommendations)
                .degraded(true)
                .mode(FilterMode.PARTIAL)
                .completedStage(run.completed)
                .build();
    }

    // ── Explanations and recommendations ──

    private Map<String, List<String>> explain(Run run, List<Notification> delivered) {
        try {
            Set<String> deliveredIds = delivered.stream().map(Notification::getId).collect(Collectors.toSet());
            Map<String, List<String>> explanations = new LinkedHashMap<>();

            for (Notification n : run.input) {
                if (deliveredIds.contains(n.getId())) {
                    continue;
                }
                Set<String> reasons = new LinkedHashSet<>(run.ledger.getOrDefault(n.getId(), List.of()));
                if (n.getPriority() == NotificationPriority.LOW && run.ctx.isWeekend()) {
                    reasons.add("Low priority notification during weekend");
                }
                if (n.getCategory() == NotificationCategory.USER && run.ctx.hasRole("admin")) {
                    reasons.add("User notification not relevant for admin role");
                }
                if (reasons.isEmpty()) {
                    reasons.add("Removed by the filtering pipeline");
                }
                explanations.put(n.getId(), new ArrayList<>(reasons));
            }
            return explanations;
        } catch (RuntimeException e) {
            log.error("Failed to generate explanations", e);
            return new LinkedHashMap<>();
        }
    }

    private List<String> recommend(Run run, List<Notification> delivered) {
        try {
            FilterPipelineProperties.Thresholds t = properties.getThresholds();
            List<String> recommendations = new ArrayList<>();

            long critical = run.input.stream().filter(n -> n.getPriority() == NotificationPriority.CRITICAL).count();
            if (critical > t.getCriticalCountRecommendation()) {
                recommendations.add("High number of critical notifications - consider reviewing system health");
            }

            if (!delivered.isEmpty()) {
                Map<NotificationCategory, Long> byCategory = new EnumMap<>(NotificationCategory.class);
                delivered.forEach(n -> byCategory.merge(n.getCategory(), 1L, Long::sum));
                byCategory.entrySet().stream()
                        .max(Map.Entry.comparingByValue())
                        .filter(e -> e.getValue() > delivered.size() * t.getDominantCategoryShare())
                        .ifPresent(e -> recommendations.add("Notifications are dominated by " + e.getKey().code()
                                + " category - consider diversifying"));
            }

            if (run.ctx.isWeekend() && delivered.size() > t.getWeekendVolume()) {
                recommendations.add("High notification volume during weekend - consider implementing quiet hours");
            }

            if (properties.isEnableBehaviorAnalysis() && run.ctx.userId() != null) {
                UserBehaviorPattern pattern = run.pattern != null
                        ? run.pattern
                        : behaviorCache.getIfPresent(run.ctx.userId()).orElse(null);
                if (pattern != null && pattern.fatigueCount() > t.getFatigueRecommendation()) {
                    recommendations.add("User showing signs of notification fatigue - consider reducing frequency");
                }
            }
            return recommendations;
        } catch (RuntimeException e) {
            log.error("Failed to generate recommendations", e);
            return new ArrayList<>();
        }
    }

    // ── Helpers ──

    private double mlConfidence(List<Notification> delivered, Run run) {
        if (!properties.isEnableMlFiltering() || delivered.isEmpty()) {
            return 1.0;
        }
        double total = 0.0;
        for (Notification n : delivered) {
            total += run.relevance(n);
        }
        return Math.max(0.0, Math.min(1.0, total / delivered.size()));
    }

    private static PipelineStatistics statistics(int total, int delivered, double confidence) {
        return PipelineStatistics.builder()
                .total(total)
                .filtered(delivered)
                .inclusionRate(total > 0 ? (double) delivered / total : 0.0)
                .mlConfidence(confidence)
                .build();
    }

    private boolean cancelled(Instant deadline) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private static void cancelFrom(List<Future<Double>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(true);
        }
    }

    /**
     * State of one {@link #filter} call.
     */
    private final class Run {
        final List<Notification> input;
        final ContextSnapshot ctx;
        final Map<String, List<String>> ledger = new HashMap<>();
        final Map<String, Double> relevanceById = new HashMap<>();
        List<Notification> current;
        PipelineStage completed;
        UserBehaviorPattern pattern;

        Run(List<Notification> input, ContextSnapshot ctx) {
            this.input = input;
            this.ctx = ctx;
            this.current = input;
        }

        void exclude(String id, String reason) {
            ledger.computeIfAbsent(id, k -> new ArrayList<>()).add(reason);
        }

        void excludeAll(String id, List<String> reasons) {
            ledger.computeIfAbsent(id, k -> new ArrayList<>()).addAll(reasons);
        }

        double relevance(Notification n) {
            Double cached = relevanceById.get(n.getId());
            if (cached != null) {
                return cached;
            }
            double relevance = contextScorer.score(n, ctx).getRelevance();
            if (n.getId() != null) {
                relevanceById.put(n.getId(), relevance);
            }
            return relevance;
        }
    }
}
