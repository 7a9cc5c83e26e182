package com.relay.notification.engine.gate;

import com.relay.notification.config.PredictorProperties;
import com.relay.notification.exception.PredictionException;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationPriority;
import com.relay.notification.model.NotificationType;
import com.relay.notification.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteModelRelevancePredictorTest {

    private static final String BASE_URL = "http://model.test";

    private MockRestServiceServer server;
    private RemoteModelRelevancePredictor predictor;
    private Notification notification;

    @BeforeEach
    void setUp() {
        PredictorProperties properties = new PredictorProperties();
        properties.setBaseUrl(BASE_URL);
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        predictor = new RemoteModelRelevancePredictor(builder.build(), properties);
        notification = TestDataFactory.createNotification("N-1", NotificationPriority.HIGH,
                NotificationCategory.WORKFLOW, NotificationType.ERROR);
    }

    @Test
    void predict_successfulResponse_returnsScore() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/predict"))
                .andExpect(method(POST))
                .andExpect(jsonPath("$.notification.id").value("N-1"))
                .andExpect(jsonPath("$.notification.priority").value("high"))
                .andRespond(withSuccess("{\"score\":0.72}", MediaType.APPLICATION_JSON));

        assertThat(predictor.predict(notification, ContextSnapshot.empty())).isEqualTo(0.72);
        server.verify();
    }

    @Test
    void predict_scoreOutOfRange_clamped() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/predict"))
                .andRespond(withSuccess("{\"score\":1.7}", MediaType.APPLICATION_JSON));

        assertThat(predictor.predict(notification, ContextSnapshot.empty())).isEqualTo(1.0);
    }

    @Test
    void predict_serverError_throwsPredictionException() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/predict"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> predictor.predict(notification, ContextSnapshot.empty()))
                .isInstanceOf(PredictionException.class)
                .hasMessageContaining("500");
    }

    @Test
    void predict_missingScore_throwsPredictionException() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/predict"))
                .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> predictor.predict(notification, ContextSnapshot.empty()))
                .isInstanceOf(PredictionException.class)
                .hasMessageContaining("no score");
    }

    @Test
    void learn_postsFeedback() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/feedback"))
                .andExpect(method(POST))
                .andExpect(jsonPath("$.notifications[0].id").value("N-1"))
                .andRespond(withStatus(HttpStatus.ACCEPTED));

        predictor.learn(List.of(notification), ContextSnapshot.empty());

        server.verify();
    }

    @Test
    void learn_serverError_throwsPredictionException() {
        server.expect(requestTo(BASE_URL + "/v1/relevance/feedback"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> predictor.learn(List.of(notification), ContextSnapshot.empty()))
                .isInstanceOf(PredictionException.class);
    }
}
