package com.relay.notification.config;

import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String mode, int delivered) {
        Counter.builder("pipeline.run.count")
                .tag("mode", mode)
                .register(registry)
                .increment();

        DistributionSummary.builder("pipeline.delivered")
                .tag("mode", mode)
                .register(registry)
                .record(delivered);
    }

    public void recordStageExcluded(String stage, int excluded) {
        if (excluded <= 0) return;
        Counter.builder("pipeline.stage.excluded")
                .tag("stage", stage)
                .register(registry)
                .increment(excluded);
    }

    public void recordStageFailure(String stage) {
        Counter.builder("pipeline.stage.failure")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordPredictorOutcome(String outcome) {
        Counter.builder("predictor.outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void bindBehaviorCache(Cache<?, ?> cache) {
        CaffeineCacheMetrics.monitor(registry, cache, "behavior.cache");
    }
}
