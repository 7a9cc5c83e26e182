package com.relay.notification.engine.gate;

import com.relay.notification.config.PredictorProperties;
import com.relay.notification.exception.PredictionException;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * Relevance predictor backed by a remote model service.
 *
 * POSTs {@code {"notification": ..., "context": ...}} to the predict path and expects
 * {@code {"score": <0..1>}}. Every transport or payload problem is reported as a
 * {@link PredictionException} so the pipeline keeps the notification.
 */
public class RemoteModelRelevancePredictor implements RelevancePredictor {

    private static final Logger log = LoggerFactory.getLogger(RemoteModelRelevancePredictor.class);

    private final RestClient restClient;
    private final PredictorProperties properties;

    public RemoteModelRelevancePredictor(RestClient restClient, PredictorProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public double predict(Notification notification, ContextSnapshot context) {
        PredictionResponse response;
        try {
            response = restClient.post()
                    .uri(properties.getPredictPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new PredictionRequest(notification, context))
                    .retrieve()
                    .body(PredictionResponse.class);
        } catch (RestClientResponseException e) {
            throw new PredictionException("Model service returned " + e.getStatusCode().value()
                    + " for notification " + notification.getId(), e);
        } catch (ResourceAccessException e) {
            throw new PredictionException("Model service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new PredictionException("Unreadable model response for notification " + notification.getId(), e);
        }

        if (response == null || response.getScore() == null || response.getScore().isNaN()) {
            throw new PredictionException("Model response carried no score for notification " + notification.getId());
        }
        return Math.max(0.0, Math.min(1.0, response.getScore()));
    }

    @Override
    public void learn(List<Notification> notifications, ContextSnapshot context) {
        try {
            restClient.post()
                    .uri(properties.getFeedbackPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new FeedbackRequest(notifications, context))
                    .retrieve()
                    .toBodilessEntity();
            log.info("Submitted {} notifications as model feedback", notifications.size());
        } catch (RestClientException e) {
            throw new PredictionException("Model feedback submission failed: " + e.getMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class PredictionRequest {
        private Notification notification;
        private ContextSnapshot context;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class FeedbackRequest {
        private List<Notification> notifications;
        private ContextSnapshot context;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class PredictionResponse {
        private Double score;
    }
}
