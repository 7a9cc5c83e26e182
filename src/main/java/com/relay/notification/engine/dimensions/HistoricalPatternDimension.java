package com.relay.notification.engine.dimensions;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.engine.RelevanceDimension;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.HistoricalContext;
import com.relay.notification.model.Notification;
import org.springframework.stereotype.Component;

/**
 * Recent volume (fatigue), per-category engagement and explicit per-category opt-in/opt-out.
 */
@Component
public class HistoricalPatternDimension implements RelevanceDimension {

    private final FilterPipelineProperties.Thresholds thresholds;

    public HistoricalPatternDimension(FilterPipelineProperties properties) {
        this.thresholds = properties.getThresholds();
    }

    @Override
    public DimensionType getDimensionType() {
        return DimensionType.HISTORICAL_PATTERNS;
    }

    @Override
    public double score(Notification notification, ContextSnapshot context) {
        HistoricalContext history = context.getHistory();
        if (history == null) {
            return 0.0;
        }

        double score = 0.0;
        int recent = history.recentCount();
        if (recent > thresholds.getHighRecentVolume()) {
            score -= 0.2;
        } else if (recent < thresholds.getLowRecentVolume()) {
            score += 0.1;
        }

        Double recorded = history.engagementFor(notification.getCategory());
        double engagement = recorded != null ? recorded : 0.0;
        if (engagement > thresholds.getHighEngagement()) {
            score += 0.3;
        } else if (engagement > thresholds.getModerateEngagement()) {
            score += 0.2;
        } else if (engagement < thresholds.getLowEngagement()) {
            score -= 0.1;
        }

        Boolean preference = history.preferenceFor(notification.getCategory());
        if (Boolean.FALSE.equals(preference)) {
            score -= 0.5;
        } else if (Boolean.TRUE.equals(preference)) {
            score += 0.2;
        }
        return score;
    }
}
