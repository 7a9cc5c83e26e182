package com.relay.notification.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification.filter.predictor")
public class PredictorProperties {

    // none: prediction stage passes everything through; noop: constant 1.0; remote: model service
    private Mode mode = Mode.NONE;

    private String baseUrl = "http://localhost:8090";
    private String predictPath = "/v1/relevance/predict";
    private String feedbackPath = "/v1/relevance/feedback";

    public enum Mode {
        NONE,
        NOOP,
        REMOTE
    }
}
