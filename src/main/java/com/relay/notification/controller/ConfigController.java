package com.relay.notification.controller;

import com.relay.notification.config.FilterPipelineProperties;
import com.relay.notification.config.PredictorProperties;
import com.relay.notification.service.FilterPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Read-only view of the effective pipeline configuration")
public class ConfigController {

    private final FilterPipelineProperties properties;
    private final PredictorProperties predictorProperties;
    private final FilterPipeline filterPipeline;

    public ConfigController(FilterPipelineProperties properties,
                            PredictorProperties predictorProperties,
                            FilterPipeline filterPipeline) {
        this.properties = properties;
        this.predictorProperties = predictorProperties;
        this.filterPipeline = filterPipeline;
    }

    @Operation(summary = "Get the effective pipeline configuration")
    @GetMapping("/pipeline")
    public ResponseEntity<Map<String, Object>> getPipelineConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("minConfidenceThreshold", properties.getMinConfidenceThreshold());
        body.put("maxNotificationsPerHour", properties.getMaxNotificationsPerHour());
        body.put("enableMlFiltering", properties.isEnableMlFiltering());
        body.put("enableContextFiltering", properties.isEnableContextFiltering());
        body.put("enableBehaviorAnalysis", properties.isEnableBehaviorAnalysis());
        body.put("enableAdaptiveFiltering", properties.isEnableAdaptiveFiltering());
        body.put("predictorMode", predictorProperties.getMode().name().toLowerCase(Locale.ROOT));
        body.put("predictorTimeoutMs", properties.getPredictorTimeoutMs());
        body.put("behaviorStore", properties.getBehaviorStore().getType());
        body.put("behaviorCacheCapacity", properties.getBehaviorCacheCapacity());
        body.put("behaviorCacheSize", filterPipeline.behaviorCacheSize());
        body.put("zoneId", properties.getZoneId());
        body.put("weights", properties.getWeights());
        return ResponseEntity.ok(body);
    }
}
