package com.relay.notification.config;

import com.relay.notification.engine.gate.HeuristicRelevancePredictor;
import com.relay.notification.engine.gate.NoOpRelevancePredictor;
import com.relay.notification.engine.gate.RelevancePredictor;
import com.relay.notification.engine.gate.RemoteModelRelevancePredictor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Relevance predictors. The "gate" predictor backs the rule filter's trailing relevance check;
 * the optional "stage" predictor backs the pipeline's prediction stage and is chosen by
 * {@code notification.filter.predictor.mode}. With mode {@code none} no stage predictor exists.
 */
@Configuration
public class FilterEngineConfig {

    @Bean
    @Qualifier("gate")
    public RelevancePredictor gateRelevancePredictor() {
        return new HeuristicRelevancePredictor();
    }

    @Bean
    @Qualifier("stage")
    @ConditionalOnProperty(name = "notification.filter.predictor.mode", havingValue = "noop")
    public RelevancePredictor noOpRelevancePredictor() {
        return new NoOpRelevancePredictor();
    }

    @Bean
    @Qualifier("stage")
    @ConditionalOnProperty(name = "notification.filter.predictor.mode", havingValue = "remote")
    public RelevancePredictor remoteModelRelevancePredictor(RestClient.Builder builder, PredictorProperties properties) {
        RestClient restClient = builder.baseUrl(properties.getBaseUrl()).build();
        return new RemoteModelRelevancePredictor(restClient, properties);
    }
}
