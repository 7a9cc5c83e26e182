package com.relay.notification.config;

import com.relay.notification.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification.filter")
public class FilterPipelineProperties {

    // Minimum context relevance a notification needs to survive the context stage.
    private double minConfidenceThreshold = 0.3;

    // Hard cap per hour; also the fatigue threshold of the behavior stage.
    private int maxNotificationsPerHour = 10;

    private boolean enableMlFiltering = false;
    private boolean enableContextFiltering = true;
    private boolean enableBehaviorAnalysis = true;

    // Gates the online-learning hook. Has no effect unless ML filtering is also on.
    private boolean enableAdaptiveFiltering = false;

    // Maximum number of per-user behavior patterns held in memory.
    private long behaviorCacheCapacity = 10_000;

    private long predictorTimeoutMs = 250;
    private int predictorParallelism = 4;

    // Zone for the hour-of-day buckets in behavior analysis.
    private String zoneId = "UTC";

    private Weights weights = new Weights();
    private Thresholds thresholds = new Thresholds();
    private BehaviorStoreSettings behaviorStore = new BehaviorStoreSettings();

    @Data
    public static class Weights {
        private double userRole = 0.30;
        private double workflowPhase = 0.25;
        private double systemStatus = 0.20;
        private double timeContext = 0.15;
        private double historicalPatterns = 0.10;
    }

    @Data
    public static class Thresholds {
        // Relevance below which the rule-filter gate drops a notification
        private double gateMinRelevance = 0.3;

        private List<String> spamPhrases = new ArrayList<>(List.of("urgent", "act now", "limited time", "click here"));
        private int spamMinMatches = 2;

        // Engagement bands used by the historical dimension and the analyzer's hints
        private double highEngagement = 0.8;
        private double moderateEngagement = 0.5;
        private double lowEngagement = 0.2;

        // Recent-volume bands (count of recent notifications)
        private int highRecentVolume = 10;
        private int lowRecentVolume = 3;
        private int riskVolume = 15;

        // Aggregate recommendations
        private int criticalCountRecommendation = 3;
        private double dominantCategoryShare = 0.6;
        private int weekendVolume = 5;
        private int fatigueRecommendation = 10;
    }

    @Data
    public static class BehaviorStoreSettings {
        // memory | aerospike
        private String type = "memory";
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * Fails fast on any value the pipeline cannot run with.
     *
     * @throws ConfigurationException naming the first offending property
     */
    public void validate() {
        requireUnit("min-confidence-threshold", minConfidenceThreshold);
        if (maxNotificationsPerHour <= 0) {
            throw new ConfigurationException("max-notifications-per-hour", "must be > 0, was " + maxNotificationsPerHour);
        }
        if (behaviorCacheCapacity <= 0) {
            throw new ConfigurationException("behavior-cache-capacity", "must be > 0, was " + behaviorCacheCapacity);
        }
        if (predictorTimeoutMs <= 0) {
            throw new ConfigurationException("predictor-timeout-ms", "must be > 0, was " + predictorTimeoutMs);
        }
        if (predictorParallelism <= 0) {
            throw new ConfigurationException("predictor-parallelism", "must be > 0, was " + predictorParallelism);
        }
        try {
            zone();
        } catch (DateTimeException | NullPointerException e) {
            throw new ConfigurationException("zone-id", "unknown zone " + zoneId);
        }

        if (weights == null) {
            throw new ConfigurationException("weights", "must be set");
        }
        requireUnit("weights.user-role", weights.getUserRole());
        requireUnit("weights.workflow-phase", weights.getWorkflowPhase());
        requireUnit("weights.system-status", weights.getSystemStatus());
        requireUnit("weights.time-context", weights.getTimeContext());
        requireUnit("weights.historical-patterns", weights.getHistoricalPatterns());

        if (thresholds == null) {
            throw new ConfigurationException("thresholds", "must be set");
        }
        requireUnit("thresholds.gate-min-relevance", thresholds.getGateMinRelevance());
        requireUnit("thresholds.dominant-category-share", thresholds.getDominantCategoryShare());
        if (thresholds.getSpamMinMatches() <= 0) {
            throw new ConfigurationException("thresholds.spam-min-matches", "must be > 0");
        }

        String storeType = behaviorStore != null ? behaviorStore.getType() : null;
        if (!"memory".equals(storeType) && !"aerospike".equals(storeType)) {
            throw new ConfigurationException("behavior-store.type", "must be memory or aerospike, was " + storeType);
        }
    }

    private static void requireUnit(String property, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(property, "must be in [0, 1], was " + value);
        }
    }
}
